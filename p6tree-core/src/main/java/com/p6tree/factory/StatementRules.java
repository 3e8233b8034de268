package com.p6tree.factory;

import com.p6tree.ast.Bareword;
import com.p6tree.ast.Block;
import com.p6tree.ast.Element;
import com.p6tree.ast.Operator;
import com.p6tree.ast.PackageName;
import com.p6tree.ast.Semicolon;
import com.p6tree.ast.Statement;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Statements, statement lists, blocks and control structures.
 */
final class StatementRules extends RuleSet {

    private static final Pattern ELSIF = Pattern.compile("\\b(?:elsif|orwith)\\b");
    private static final Pattern ELSE = Pattern.compile("\\belse\\b");
    private static final Pattern WHILE_UNTIL = Pattern.compile("\\b(?:while|until)\\b");

    private static final Set<String> CONDITIONALS = Set.of("if", "with");
    private static final Set<String> XBLOCK_CONTROLS =
        Set.of("unless", "without", "while", "until", "for", "given", "when", "whenever");
    private static final Set<String> MODULE_CONTROLS = Set.of("use", "no", "need", "import", "require");

    StatementRules(Rules rules) {
        super(rules);
    }

    // ========================================================================
    // Statement lists
    // ========================================================================

    List<Element> compUnit(Match p) {
        Shape shape = shape(p);
        if (shape.is("statementlist")) {
            return statementlist(p.get("statementlist"));
        }
        if (shape.is(keys(), "statementlist")) {
            return List.of();
        }
        if (shape.is("statement")) {
            return statementlist(p);
        }
        if (shape.is()) {
            return List.of();
        }
        throw unhandled("comp_unit", p);
    }

    List<Element> statementlist(Match p) {
        Shape shape = shape(p);
        if (shape.is("statement")) {
            List<Element> statements = new ArrayList<>();
            int claimed = p.from();
            for (Match match : p.getAll("statement")) {
                Statement statement = statement(match, claimed);
                if (statement != null) {
                    statements.add(statement);
                    claimed = statement.to();
                }
            }
            return statements;
        }
        if (shape.is()) {
            return List.of();
        }
        throw unhandled("statementlist", p);
    }

    /**
     * A statement and its semicolon. Returns null for an empty statement that has
     * no semicolon of its own.
     */
    Statement statement(Match p, int claimed) {
        List<Element> children = statementContent(p);
        int end = Math.max(end(children, p.from()), claimed);
        Semicolon semicolon = trailingSemicolon(end);
        if (semicolon != null) {
            children.add(semicolon);
        }
        if (children.isEmpty()) {
            return null;
        }
        return adapter.branch(Statement::new, children, p.from(), p.to());
    }

    /** What a statement contains, without its semicolon. */
    List<Element> statementContent(Match p) {
        List<Element> children = new ArrayList<>();
        Shape shape = shape(p);
        if (shape.is("EXPR", "statement_mod_cond")) {
            children.addAll(rules.expressions.expr(p.get("EXPR")));
            children.addAll(statementModCond(p.get("statement_mod_cond")));
        } else if (shape.is("EXPR", "statement_mod_loop")) {
            children.addAll(rules.expressions.expr(p.get("EXPR")));
            children.addAll(statementModLoop(p.get("statement_mod_loop")));
        } else if (shape.is("EXPR")) {
            children.addAll(rules.expressions.expr(p.get("EXPR")));
        } else if (shape.is("statement_control")) {
            children.addAll(statementControl(p.get("statement_control")));
        } else if (!shape.is()) {
            throw unhandled("statement", p);
        }
        return children;
    }

    /**
     * A {@code ;} after {@code offset}, past whitespace and comments but never into a
     * here-document body.
     */
    private Semicolon trailingSemicolon(int offset) {
        int i = skipWhitespaceAndComments(offset, orig.length());
        if (i < orig.length() && orig.charAt(i) == ';' && !rules.context().hereDocs().isInsideBody(i)) {
            return adapter.fromInt(Semicolon::new, i, ";");
        }
        return null;
    }

    /**
     * The statements of a semicolon list inside brackets, flattened: the contents of
     * each statement followed by its semicolon.
     */
    List<Element> semilist(Match p) {
        Shape shape = shape(p);
        if (shape.is("statement")) {
            List<Element> children = new ArrayList<>();
            int claimed = p.from();
            for (Match match : p.getAll("statement")) {
                List<Element> content = statementContent(match);
                int end = Math.max(end(content, match.from()), claimed);
                children.addAll(content);
                Semicolon semicolon = semicolonBefore(end, p.to());
                if (semicolon != null) {
                    children.add(semicolon);
                    end = semicolon.to();
                }
                claimed = end;
            }
            return children;
        }
        if (shape.is()) {
            return List.of();
        }
        throw unhandled("semilist", p);
    }

    private Semicolon semicolonBefore(int offset, int limit) {
        int i = skipWhitespaceAndComments(offset, limit);
        if (i < limit && orig.charAt(i) == ';') {
            return adapter.fromInt(Semicolon::new, i, ";");
        }
        return null;
    }

    // ========================================================================
    // Statement modifiers
    // ========================================================================

    List<Element> statementModCond(Match p) {
        Shape shape = shape(p);
        if (shape.is("sym", "modifier_expr")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(modifierExpr(p.get("modifier_expr")));
            return children;
        }
        throw unhandled("statement_mod_cond", p);
    }

    List<Element> statementModLoop(Match p) {
        Shape shape = shape(p);
        if (shape.is("sym", "smexpr")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(modifierExpr(p.get("smexpr")));
            return children;
        }
        throw unhandled("statement_mod_loop", p);
    }

    private List<Element> modifierExpr(Match p) {
        if (shape(p).is("EXPR")) {
            return rules.expressions.expr(p.get("EXPR"));
        }
        throw unhandled("modifier_expr", p);
    }

    // ========================================================================
    // Control structures
    // ========================================================================

    List<Element> statementControl(Match p) {
        String sym = sym(p);
        Shape shape = shape(p);
        if (CONDITIONALS.contains(sym)) {
            if (shape.is("sym", "xblock")) {
                return conditional(p, null);
            }
            if (shape.is("sym", "xblock", "else")) {
                return conditional(p, p.get("else"));
            }
        } else if (XBLOCK_CONTROLS.contains(sym)) {
            if (shape.is("sym", "xblock")) {
                List<Element> children = new ArrayList<>();
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.addAll(xblock(p.get("xblock")));
                return children;
            }
        } else if (sym.equals("loop")) {
            if (shape.isOptionally(keys("sym", "block"), "e1", "e2", "e3")) {
                if (hasLoopHeader(p)) {
                    return loop(p);
                }
                List<Element> children = new ArrayList<>();
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.addAll(block(p.get("block")));
                return children;
            }
        } else if (sym.equals("repeat")) {
            if (shape.is("sym", "wu", "xblock")) {
                List<Element> children = new ArrayList<>();
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.add(adapter.fromMatch(Bareword::new, p.get("wu")));
                children.addAll(xblock(p.get("xblock")));
                return children;
            }
            if (shape.is("sym", "pblock", "wu", "EXPR")) {
                List<Element> children = new ArrayList<>();
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.addAll(pblock(p.get("pblock")));
                children.add(adapter.fromMatch(Bareword::new, p.get("wu")));
                children.addAll(rules.expressions.expr(p.get("EXPR")));
                return children;
            }
            if (shape.is("sym", "pblock", "EXPR")) {
                // older grammars leave the while/until keyword uncaptured
                List<Element> children = new ArrayList<>();
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                List<Element> body = pblock(p.get("pblock"));
                children.addAll(body);
                Match expr = p.get("EXPR");
                children.add(locate(Bareword::new, end(body, p.from()), expr.from(), WHILE_UNTIL));
                children.addAll(rules.expressions.expr(expr));
                return children;
            }
        } else if (MODULE_CONTROLS.contains(sym)) {
            return moduleControl(sym, shape, p);
        } else if (shape.is("sym", "block")) {
            // default, CATCH, CONTROL, QUIT and the phasers
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(block(p.get("block")));
            return children;
        }
        throw unhandled("statement_control", p);
    }

    private List<Element> conditional(Match p, Match elseBlock) {
        List<Element> children = new ArrayList<>();
        children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
        List<Match> xblocks = p.getAll("xblock");
        for (int i = 0; i < xblocks.size(); i++) {
            Match xblock = xblocks.get(i);
            if (i > 0) {
                children.add(locate(Bareword::new, end(children, p.from()), xblock.from(), ELSIF));
            }
            children.addAll(xblock(xblock));
        }
        if (elseBlock != null) {
            children.add(locate(Bareword::new, end(children, p.from()), elseBlock.from(), ELSE));
            children.addAll(pblock(elseBlock));
        }
        return children;
    }

    private boolean hasLoopHeader(Match p) {
        int open = skipWhitespace(p.get("sym").to());
        return open < p.get("block").from() && orig.charAt(open) == '(';
    }

    private List<Element> loop(Match p) {
        List<Element> children = new ArrayList<>();
        Match sym = p.get("sym");
        Match block = p.get("block");
        children.add(adapter.fromMatch(Bareword::new, sym));

        int open = skipWhitespace(sym.to());
        int close = skipWhitespaceBack(block.from());
        if (open >= close || orig.charAt(open) != '(' || orig.charAt(close - 1) != ')') {
            throw unhandled("statement_control:loop", p);
        }
        List<Element> header = new ArrayList<>();
        int cursor = open + 1;
        String[] parts = {"e1", "e2", "e3"};
        for (int i = 0; i < parts.length; i++) {
            Match part = p.get(parts[i]);
            if (part != null && part.to() > part.from()) {
                List<Element> expression = rules.expressions.expr(part);
                header.addAll(expression);
                cursor = end(expression, cursor);
            }
            if (i < parts.length - 1) {
                Semicolon semicolon = locate(Semicolon::new, cursor, close - 1, ";");
                header.add(semicolon);
                cursor = semicolon.to();
            }
        }
        children.add(adapter.balanced(Operator.Circumfix::new, open, close, header));
        children.addAll(block(block));
        return children;
    }

    private List<Element> moduleControl(String sym, Shape shape, Match p) {
        List<Element> children = new ArrayList<>();
        children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
        if (shape.is("sym", "module_name")) {
            children.add(moduleName(p.get("module_name")));
            return children;
        }
        if (shape.is("sym", "module_name", "arglist")) {
            children.add(moduleName(p.get("module_name")));
            children.addAll(rules.expressions.arglist(p.get("arglist")));
            return children;
        }
        if (shape.is("sym", "version") && !sym.equals("import")) {
            children.add(rules.values.version(p.get("version")));
            return children;
        }
        if (shape.is("sym", "EXPR") && sym.equals("require")) {
            children.addAll(rules.expressions.expr(p.get("EXPR")));
            return children;
        }
        throw unhandled("statement_control:" + sym, p);
    }

    private PackageName moduleName(Match p) {
        if (shape(p).is("longname")) {
            return adapter.fromMatch(PackageName::new, p.get("longname"));
        }
        throw unhandled("module_name", p);
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    List<Element> xblock(Match p) {
        if (shape(p).is("EXPR", "pblock")) {
            List<Element> children = new ArrayList<>(rules.expressions.expr(p.get("EXPR")));
            children.addAll(pblock(p.get("pblock")));
            return children;
        }
        throw unhandled("xblock", p);
    }

    /** A block, possibly pointy: {@code -> $x { ... }}. */
    List<Element> pblock(Match p) {
        Shape shape = shape(p);
        if (shape.is("blockoid")) {
            return List.of(blockoid(p.get("blockoid")));
        }
        if (shape.is("lambda", "signature", "blockoid")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Operator.Prefix::new, p.get("lambda")));
            children.addAll(rules.routines.signature(p.get("signature")));
            children.add(blockoid(p.get("blockoid")));
            return children;
        }
        if (shape.is(keys("lambda", "blockoid"), "signature")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Operator.Prefix::new, p.get("lambda")));
            children.add(blockoid(p.get("blockoid")));
            return children;
        }
        throw unhandled("pblock", p);
    }

    List<Element> block(Match p) {
        if (shape(p).is("blockoid")) {
            return List.of(blockoid(p.get("blockoid")));
        }
        throw unhandled("block", p);
    }

    /** {@code { statements }}; the match includes the braces. */
    Block blockoid(Match p) {
        Shape shape = shape(p);
        if (shape.is("statementlist")) {
            return adapter.balanced(Block::new, p, statementlist(p.get("statementlist")));
        }
        if (shape.is()) {
            return adapter.balanced(Block::new, p, List.of());
        }
        throw unhandled("blockoid", p);
    }

    // ========================================================================
    // Statement prefixes
    // ========================================================================

    /** {@code do}, {@code try}, {@code gather}, {@code BEGIN}, {@code start}, {@code lazy}... */
    List<Element> statementPrefix(Match p) {
        if (shape(p).is("sym", "blorst")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(blorst(p.get("blorst")));
            return children;
        }
        throw unhandled("statement_prefix", p);
    }

    private List<Element> blorst(Match p) {
        Shape shape = shape(p);
        if (shape.is("block")) {
            return block(p.get("block"));
        }
        if (shape.is("statement")) {
            return statementContent(p.get("statement"));
        }
        throw unhandled("blorst", p);
    }

    /** Orders elements built from captures that the grammar does not keep in source order. */
    static void sortBySource(List<Element> elements) {
        elements.sort(Comparator.comparingInt(Element::from));
    }
}
