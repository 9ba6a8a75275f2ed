package com.pbxguard.serializer;

import com.pbxguard.value.ArrayValue;
import com.pbxguard.value.Comments;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Document;
import com.pbxguard.value.IdentValue;
import com.pbxguard.value.Identifiers;
import com.pbxguard.value.Value;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Writes a {@link Document} in the canonical layout Xcode itself produces.
 * Output depends only on the tree, never on how the input was formatted, so
 * serializing twice yields identical bytes.
 */
public class CanonicalSerializer {

    private static final List<String> ROOT_KEY_PRIORITY =
        List.of("archiveVersion", "classes", "objectVersion", "objects", "rootObject");
    private static final Set<String> INLINE_ISAS = Set.of("PBXBuildFile", "PBXFileReference");
    private static final Pattern SAFE_BAREWORD = Pattern.compile("[A-Za-z0-9_$/:.]+");
    private static final String ISA = "isa";

    public byte[] serializeBytes(Document document) {
        return serialize(document).getBytes(StandardCharsets.UTF_8);
    }

    public String serialize(Document document) {
        StringBuilder out = new StringBuilder();
        out.append(Document.MAGIC_HEADER).append('\n');
        out.append("{\n");
        for (DictValue.Entry entry : sortRootEntries(document.getRoot())) {
            if (Document.OBJECTS_KEY.equals(entry.getKey()) && entry.getValue().isDict()) {
                indent(out, 1);
                out.append(Document.OBJECTS_KEY).append(" = {\n");
                writeObjects(out, entry.getValue().asDict());
                indent(out, 1);
                out.append("};\n");
            } else {
                writeEntry(out, entry, 1, false);
            }
        }
        out.append("}\n");
        return out.toString();
    }

    /**
     * Renders one value the way it would appear on a single line, e.g. for diagnostics.
     */
    public String renderValue(Value value) {
        StringBuilder out = new StringBuilder();
        writeValue(out, value, 0, true);
        return out.toString();
    }

    private void writeObjects(StringBuilder out, DictValue objects) {
        Map<String, List<DictValue.Entry>> sections = new TreeMap<>(IsaOrder.INSTANCE);
        List<DictValue.Entry> unsectioned = new ArrayList<>();
        for (DictValue.Entry entry : objects) {
            String isa = isaOf(entry.getValue());
            if (isa == null) {
                unsectioned.add(entry);
            } else {
                sections.computeIfAbsent(isa, k -> new ArrayList<>()).add(entry);
            }
        }
        for (Map.Entry<String, List<DictValue.Entry>> section : sections.entrySet()) {
            List<DictValue.Entry> records = section.getValue();
            records.sort(Comparator.comparing(DictValue.Entry::getKey));
            boolean inline = INLINE_ISAS.contains(section.getKey());
            out.append('\n');
            out.append("/* Begin ").append(section.getKey()).append(" section */\n");
            for (DictValue.Entry record : records) {
                writeEntry(out, record, 2, inline);
            }
            out.append("/* End ").append(section.getKey()).append(" section */\n");
        }
        if (!unsectioned.isEmpty()) {
            unsectioned.sort(Comparator.comparing(DictValue.Entry::getKey));
            out.append('\n');
            for (DictValue.Entry record : unsectioned) {
                writeEntry(out, record, 2, false);
            }
        }
    }

    private void writeEntry(StringBuilder out, DictValue.Entry entry, int depth, boolean inlineValue) {
        indent(out, depth);
        writeKey(out, entry);
        out.append(" = ");
        writeValue(out, entry.getValue(), depth, inlineValue);
        out.append(";\n");
    }

    private void writeKey(StringBuilder out, DictValue.Entry entry) {
        String key = entry.getKey();
        out.append(Identifiers.isWellFormed(key) ? key : quoteIfNeeded(key, false));
        writeComment(out, entry.getKeyComment());
    }

    private void writeComment(StringBuilder out, String comment) {
        String text = Comments.escape(comment);
        if (text != null) {
            out.append(" /* ").append(text).append(" */");
        }
    }

    private void writeValue(StringBuilder out, Value value, int depth, boolean inline) {
        if (value.isIdent()) {
            IdentValue ident = value.asIdent();
            out.append(ident.getId());
            writeComment(out, ident.getComment());
        } else if (value.isString()) {
            out.append(quoteIfNeeded(value.asString().getText(), true));
        } else if (value.isDict()) {
            writeDict(out, value.asDict(), depth, inline);
        } else {
            writeArray(out, value.asArray(), depth, inline);
        }
    }

    private void writeDict(StringBuilder out, DictValue dict, int depth, boolean inline) {
        List<DictValue.Entry> entries = sortRecordEntries(dict);
        if (inline) {
            if (entries.isEmpty()) {
                out.append("{}");
                return;
            }
            out.append('{');
            for (DictValue.Entry entry : entries) {
                writeKey(out, entry);
                out.append(" = ");
                writeValue(out, entry.getValue(), depth, true);
                out.append("; ");
            }
            out.append('}');
            return;
        }
        out.append("{\n");
        for (DictValue.Entry entry : entries) {
            writeEntry(out, entry, depth + 1, false);
        }
        indent(out, depth);
        out.append('}');
    }

    private void writeArray(StringBuilder out, ArrayValue array, int depth, boolean inline) {
        if (inline) {
            out.append('(');
            for (Value element : array) {
                writeValue(out, element, depth, true);
                out.append(", ");
            }
            out.append(')');
            return;
        }
        out.append("(\n");
        for (Value element : array) {
            indent(out, depth + 1);
            writeValue(out, element, depth + 1, false);
            out.append(",\n");
        }
        indent(out, depth);
        out.append(')');
    }

    private List<DictValue.Entry> sortRootEntries(DictValue root) {
        List<DictValue.Entry> entries = new ArrayList<>(root.getEntries());
        entries.sort((a, b) -> {
            int pa = ROOT_KEY_PRIORITY.indexOf(a.getKey());
            int pb = ROOT_KEY_PRIORITY.indexOf(b.getKey());
            if (pa >= 0 && pb >= 0) {
                return Integer.compare(pa, pb);
            }
            if (pa >= 0) {
                return -1;
            }
            if (pb >= 0) {
                return 1;
            }
            return a.getKey().compareTo(b.getKey());
        });
        return entries;
    }

    /**
     * {@code isa} first, then plain ASCII order.
     */
    private List<DictValue.Entry> sortRecordEntries(DictValue dict) {
        List<DictValue.Entry> entries = new ArrayList<>(dict.getEntries());
        entries.sort((a, b) -> {
            boolean aIsa = ISA.equals(a.getKey());
            boolean bIsa = ISA.equals(b.getKey());
            if (aIsa != bIsa) {
                return aIsa ? -1 : 1;
            }
            return a.getKey().compareTo(b.getKey());
        });
        return entries;
    }

    private static String isaOf(Value record) {
        if (!record.isDict()) {
            return null;
        }
        Value isa = record.asDict().get(ISA);
        return isa != null && isa.isString() ? isa.asString().getText() : null;
    }

    /**
     * Quotes text unless it is a plain bareword. Values shaped like an object id
     * are always quoted so they read back as text, not as a reference.
     */
    static String quoteIfNeeded(String text, boolean quoteIdShaped) {
        boolean needsQuotes = text.isEmpty()
            || !SAFE_BAREWORD.matcher(text).matches()
            || text.contains("//")
            || text.contains("___")
            || (quoteIdShaped && Identifiers.isWellFormed(text));
        return needsQuotes ? quote(text) : text;
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\U%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    private static void indent(StringBuilder out, int depth) {
        for (int i = 0; i < depth; i++) {
            out.append('\t');
        }
    }
}
