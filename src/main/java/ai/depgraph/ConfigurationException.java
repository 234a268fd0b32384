package ai.depgraph;

import java.io.IOException;

/**
 * The analysis cannot start: target missing, unreadable, or an input file given on the
 * command line does not exist.
 */
public class ConfigurationException extends IOException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
