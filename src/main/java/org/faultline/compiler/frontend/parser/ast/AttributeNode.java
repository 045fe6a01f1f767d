package org.faultline.compiler.frontend.parser.ast;

import org.faultline.compiler.api.SourceInfo;
import org.faultline.compiler.frontend.lexer.Token;

/**
 * One {@code key = value} or {@code flag} item of a {@code #[diag(...)]} attribute,
 * captured without interpretation.
 *
 * @param key The token of the attribute key.
 * @param value The token of the literal value, or null for a flag.
 */
public record AttributeNode(
        Token key,
        Token value
) {

    /**
     * @return The attribute key as written.
     */
    public String name() {
        return key.text();
    }

    /**
     * @return Whether a value was written after the key.
     */
    public boolean hasValue() {
        return value != null;
    }

    /**
     * @return The position of the whole item, from key to value.
     */
    public SourceInfo sourceInfo() {
        SourceInfo k = key.sourceInfo();
        if (value == null) {
            return k;
        }
        return new SourceInfo(k.fileName(), k.lineNumber(), k.columnNumber(), k.startOffset(),
                value.offset() + value.text().length());
    }
}
