package org.hybridnet.model;

/**
 * Raised while building a net or its behaviors when the declared parameters
 * cannot be simulated. The model has to be fixed before simulating.
 */
public class ModelConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ModelConfigurationException(String message) {
        super(message);
    }

    public ModelConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
