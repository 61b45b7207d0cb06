package org.pragmatica.harel.error;

/**
 * Front end stage that produced a diagnostic.
 */
public enum Stage {
    LEX,
    PARSE,
    VALIDATE
}
