package com.musicbox.domain.model;

import com.musicbox.domain.exception.ValidationException;

import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Identidad normalizada de un tag NFC físico.
 * <p>
 * El UID se normaliza una única vez al construir: se eliminan los separadores
 * ({@code :}, {@code -} y espacios) y se pasa a minúsculas. Por eso
 * {@code "04:F7:ED"} y {@code "04f7ed"} son el mismo tag.
 *
 * @param uid UID en hexadecimal, minúsculas y sin separadores
 */
public record TagIdentifier(String uid) {

    private static final int MIN_LENGTH = 4;
    private static final Pattern SEPARATORS = Pattern.compile("[:\\-\\s]");
    private static final Pattern HEX = Pattern.compile("[0-9a-f]+");

    public TagIdentifier {
        if (uid == null) {
            throw ValidationException.invalidTagUid(null, "vacío");
        }
        String normalized = SEPARATORS.matcher(uid).replaceAll("").toLowerCase();
        if (normalized.isEmpty()) {
            throw ValidationException.invalidTagUid(uid, "vacío");
        }
        if (normalized.length() < MIN_LENGTH) {
            throw ValidationException.invalidTagUid(uid, "menos de " + MIN_LENGTH + " caracteres");
        }
        if (!HEX.matcher(normalized).matches()) {
            throw ValidationException.invalidTagUid(uid, "caracteres no hexadecimales");
        }
        uid = normalized;
    }

    /**
     * Crea un identificador a partir del texto leído del lector.
     *
     * @param raw UID en cualquier combinación de mayúsculas y separadores
     * @return Identificador normalizado
     * @throws ValidationException si el UID no es válido
     */
    public static TagIdentifier parse(String raw) {
        return new TagIdentifier(raw);
    }

    /**
     * Crea un identificador a partir de los bytes crudos del UID.
     */
    public static TagIdentifier fromRawBytes(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw ValidationException.invalidTagUid("", "sin bytes");
        }
        return parse(HexFormat.of().formatHex(bytes));
    }

    @Override
    public String toString() {
        return uid;
    }
}
