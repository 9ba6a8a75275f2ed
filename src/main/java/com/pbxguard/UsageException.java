package com.pbxguard;

/**
 * Bad command line: unknown flag, missing argument, or an ambiguous name.
 */
public class UsageException extends Exception {
    public UsageException(String message) {
        super(message);
    }
}
