package com.zeronote.server.web;

public record ErrorResponse(String error, int status) {
}
