package com.jmerl.template;

import com.jmerl.MerlException;

/**
 * A placeholder is used where it cannot stand.
 */
public class TemplateException extends MerlException {
    public TemplateException(String message) {
        super(message);
    }
}
