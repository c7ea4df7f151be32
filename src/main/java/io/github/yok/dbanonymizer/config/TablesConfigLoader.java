package io.github.yok.dbanonymizer.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.dbanonymizer.model.TablesConfiguration;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

/**
 * Loads the tables configuration file.
 *
 * <p>
 * The file is JSON:
 * </p>
 *
 * <pre>
 * {
 *   "tables": [
 *     { "tableName": "CMS_User", "anonymizeColumns": ["UserName"], "nullColumns": ["Email"] }
 *   ]
 * }
 * </pre>
 *
 * <p>
 * When the file does not exist, the bundled default configuration ({@value #DEFAULT_RESOURCE}) is
 * written to the requested path first, so the user gets an editable starting point.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class TablesConfigLoader {

    static final String DEFAULT_RESOURCE = "default-tables.json";

    private final ObjectMapper mapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Reads the tables configuration, creating it from the defaults when missing.
     *
     * @param path configuration file path
     * @return tables configuration
     * @throws IOException if the file cannot be written or parsed
     */
    public TablesConfiguration load(Path path) throws IOException {
        if (!Files.exists(path)) {
            writeDefault(path);
        }
        log.info("Reading tables configuration: {}", path.toAbsolutePath().normalize());
        TablesConfiguration config = mapper.readValue(path.toFile(), TablesConfiguration.class);
        log.info("Configured tables: {}", config.getTables().size());
        return config;
    }

    /**
     * Returns the bundled default configuration.
     *
     * @return default tables configuration
     * @throws IOException if the resource is missing or invalid
     */
    public TablesConfiguration loadDefault() throws IOException {
        try (InputStream in = openDefault()) {
            return mapper.readValue(in, TablesConfiguration.class);
        }
    }

    private void writeDefault(Path path) throws IOException {
        log.info("Tables configuration not found; writing defaults to {}",
                path.toAbsolutePath().normalize());
        try (InputStream in = openDefault()) {
            FileUtils.copyInputStreamToFile(in, path.toFile());
        }
    }

    private InputStream openDefault() throws IOException {
        InputStream in = TablesConfigLoader.class.getClassLoader()
                .getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new FileNotFoundException("Classpath resource not found: " + DEFAULT_RESOURCE);
        }
        return in;
    }
}
