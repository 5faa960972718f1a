package com.jmerl.template;

import com.jmerl.MerlException;

/**
 * A node-level placeholder was bound to a list, or a group-level placeholder to a single tree.
 */
public class EnvironmentTypeException extends MerlException {
    public EnvironmentTypeException(String message) {
        super(message);
    }
}
