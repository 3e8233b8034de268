package com.p6tree.ast;

/**
 * A variable: sigil, optional twigil and name, e.g. {@code $x}, {@code @*ARGS},
 * {@code %!attributes}, {@code &callback}, {@code $<name>}, {@code $0}.
 */
public final class Variable extends Leaf {

    private final VariableKind kind;

    public Variable(int from, int to, String content, VariableKind kind) {
        super(from, to, content);
        this.kind = kind;
    }

    public VariableKind kind() {
        return kind;
    }

    public VariableKind.Sigil sigil() {
        return kind.sigil();
    }

    public VariableKind.Twigil twigil() {
        return kind.twigil();
    }

    /** The name without sigil and twigil; {@code $<foo>} yields {@code foo}, {@code $0} yields {@code 0}. */
    public String name() {
        String rest = content().substring(1);
        String twigil = kind.twigil().symbol();
        if (!twigil.isEmpty() && rest.startsWith(twigil)) {
            rest = rest.substring(twigil.length());
        }
        if (kind.twigil() == VariableKind.Twigil.MATCH_INDEX && rest.endsWith(">")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        return rest;
    }
}
