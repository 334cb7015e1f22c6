package com.starterkit.generator.template;

import com.starterkit.generator.api.GenerationException;

/**
 * Configuration or input error detected before the archive stream is opened:
 * an unreadable base manifest or schema, an overlay source that does not exist,
 * or a mapping path that escapes its root. No byte has been written when this is thrown.
 */
public class BaseTemplateException extends GenerationException {

    public BaseTemplateException(String message) {
        super(message);
    }

    public BaseTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
