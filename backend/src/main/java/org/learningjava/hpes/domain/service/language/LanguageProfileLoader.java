package org.learningjava.hpes.domain.service.language;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.learningjava.hpes.domain.model.language.ProfileConfigurationException;
import org.learningjava.hpes.domain.policy.LanguageProfileConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/** Reads the YAML profile table from the classpath. */
public final class LanguageProfileLoader {

    private static final Logger log = LoggerFactory.getLogger(LanguageProfileLoader.class);

    public static final String DEFAULT_LOCATION = "/language_profiles/profiles.yml";

    private LanguageProfileLoader() {
    }

    public static LanguageProfileConfig load(String classpathLocation) {
        try (InputStream in = LanguageProfileLoader.class.getResourceAsStream(classpathLocation)) {
            if (in == null) {
                throw new ProfileConfigurationException("Profile table not found on classpath: " + classpathLocation);
            }
            LanguageProfileConfig config = read(in);
            log.info("Read {} language entries from {}",
                    config.getLanguages() == null ? 0 : config.getLanguages().size(), classpathLocation);
            return config;
        } catch (IOException e) {
            throw new ProfileConfigurationException("Failed to read profile table " + classpathLocation, e);
        }
    }

    public static LanguageProfileConfig read(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(in, LanguageProfileConfig.class);
    }
}
