package org.learningjava.hpes.config;

import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.service.language.LanguageProfileLoader;
import org.learningjava.hpes.domain.service.language.LanguageProfileRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class AppConfig {

    // profile table + every grammar adapter on the classpath
    @Bean
    LanguageProfileRegistry languageProfileRegistry(
            @Value("${hpes.profiles.location:" + LanguageProfileLoader.DEFAULT_LOCATION + "}") String location,
            List<GrammarParserPort> grammars) {
        return new LanguageProfileRegistry(LanguageProfileLoader.load(location), grammars);
    }
}
