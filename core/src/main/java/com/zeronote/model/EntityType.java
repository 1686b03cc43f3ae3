package com.zeronote.model;

public enum EntityType {
    NOTE,
    FOLDER
}
