package com.pbxguard.value;

/**
 * Rules for the {@code /* ... *&#47;} annotations carried by keys and identifiers.
 * A stored comment is trimmed and never blank, which is what the tokenizer yields
 * when the annotation is read back.
 */
public final class Comments {
    public static final String TERMINATOR = "*/";

    private Comments() {}

    /**
     * Trims surrounding whitespace; a blank comment becomes {@code null}.
     */
    public static String normalize(String comment) {
        if (comment == null) {
            return null;
        }
        String trimmed = comment.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Whether the comment can be written inside a block annotation without ending it early.
     */
    public static boolean isWritable(String comment) {
        return comment == null || !comment.contains(TERMINATOR);
    }

    /**
     * Text as it goes between the annotation delimiters. A terminator inside the
     * comment is split so the annotation still closes where it should.
     */
    public static String escape(String comment) {
        String text = normalize(comment);
        if (text == null) {
            return null;
        }
        while (text.contains(TERMINATOR)) {
            text = text.replace(TERMINATOR, "* /");
        }
        return text;
    }
}
