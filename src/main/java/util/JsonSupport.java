package util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import config.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared Gson instance and loading of JSON from a file path or a classpath resource.
 */
public final class JsonSupport {

    public static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    private JsonSupport() {
    }

    /**
     * Reads {@code location} as a file when it exists, otherwise as a classpath resource.
     *
     * @throws ConfigurationException if the location cannot be found or parsed
     */
    public static <T> T read(String location, Class<T> type) {
        try (Reader reader = open(location)) {
            T value = GSON.fromJson(reader, type);
            if (value == null) {
                throw new ConfigurationException("Empty JSON document: " + location);
            }
            return value;
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed JSON in " + location + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + location, e);
        }
    }

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    public static void write(Path path, Object value) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(value), StandardCharsets.UTF_8);
    }

    private static Reader open(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        }
        String resource = location.startsWith("/") ? location.substring(1) : location;
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
        if (in == null) {
            in = JsonSupport.class.getClassLoader().getResourceAsStream(resource);
        }
        if (in == null) {
            throw new ConfigurationException("No file or classpath resource named " + location);
        }
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }
}
