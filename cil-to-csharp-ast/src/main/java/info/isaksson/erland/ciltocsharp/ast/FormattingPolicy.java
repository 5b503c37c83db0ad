package info.isaksson.erland.ciltocsharp.ast;

/**
 * Whitespace options for {@link CSharpPrinter}.
 *
 * <p>Raw statements are emitted verbatim, so {@link #spaceBeforeMethodCallParens} only affects
 * calls the printer generates itself.</p>
 */
public final class FormattingPolicy {
    public boolean spaceBeforeMethodCallParens = true;
    public boolean spaceBeforeMethodDeclParens = true;
    public String indentation = "\t";
    public String newLine = "\n";

    /** The policy used for decompiled output: no space in front of parentheses. */
    public static FormattingPolicy decompilerDefault() {
        FormattingPolicy p = new FormattingPolicy();
        p.spaceBeforeMethodCallParens = false;
        p.spaceBeforeMethodDeclParens = false;
        return p;
    }
}
