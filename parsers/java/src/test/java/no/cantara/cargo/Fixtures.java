package no.cantara.cargo;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Shared test utility for locating fixtures under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Path fixture(String name, String file) {
        URL url = Fixtures.class.getClassLoader().getResource("fixtures/" + name + "/" + file);
        assertNotNull(url, "fixture not found: " + name + "/" + file);
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
