package org.adcp.broker.util;

import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * This class consists of {@code static} utility methods for operating application resources.
 */
public class ResourceUtil {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private ResourceUtil() {
    }

    /**
     * Reads a settings resource. Locations starting with {@value #CLASSPATH_PREFIX} are looked up on the
     * classpath, anything else is treated as a file system path.
     * Throws {@link IllegalArgumentException} if the resource was not found.
     */
    public static String read(String location) throws IOException {
        if (StringUtils.startsWith(location, CLASSPATH_PREFIX)) {
            return readFromClasspath(StringUtils.removeStart(location, CLASSPATH_PREFIX));
        }

        final Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Could not find file at path: %s".formatted(location));
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Reads files from classpath. Throws {@link IllegalArgumentException} if file was not found.
     */
    public static String readFromClasspath(String path) throws IOException {
        final InputStream resourceAsStream = ResourceUtil.class.getClassLoader().getResourceAsStream(path);

        if (resourceAsStream == null) {
            throw new IllegalArgumentException("Could not find file at path: %s".formatted(path));
        }

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resourceAsStream,
                StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        }
    }
}
