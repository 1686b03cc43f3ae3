package com.zeronote.server.config;

import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.zeronote.json.ZeroNoteJson;
import com.zeronote.sync.arbiter.ConflictResolver;
import com.zeronote.sync.arbiter.PushArbiter;

@Configuration
public class ZeroNoteServerConfig {

    @Bean
    public PushArbiter pushArbiter(ZeroNoteProperties properties) {
        return new PushArbiter(new ConflictResolver(), properties.sync().casRetries());
    }

    /** Same JSON settings as the devices, so stored payloads and wire bodies agree. */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer zeroNoteJson() {
        return builder -> builder.postConfigurer(ZeroNoteJson::configure);
    }
}
