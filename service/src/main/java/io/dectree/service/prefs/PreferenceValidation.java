// file: service/src/main/java/io/dectree/service/prefs/PreferenceValidation.java
package io.dectree.service.prefs;

/**
 * Result of validating a preference value.
 *
 * @param value   normalised value when valid, null otherwise
 * @param message reason when invalid, null otherwise
 */
public record PreferenceValidation(boolean valid, Object value, String message) {

    public static PreferenceValidation ok(Object value) {
        return new PreferenceValidation(true, value, null);
    }

    public static PreferenceValidation invalid(String message) {
        return new PreferenceValidation(false, null, message);
    }
}
