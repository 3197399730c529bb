package no.cantara.cargo;

/**
 * Thrown when manifest TOML or metadata JSON is not syntactically valid.
 */
public class CargoParseException extends IllegalArgumentException {

    public CargoParseException(String message) {
        super(message);
    }

    public CargoParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
