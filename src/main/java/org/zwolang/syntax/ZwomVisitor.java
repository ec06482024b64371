package org.zwolang.syntax;

import io.vavr.control.Either;
import org.zwolang.error.SyntaxError;
import org.zwolang.error.ZwomError;
import org.zwolang.model.Block;
import org.zwolang.model.Message;
import org.zwolang.model.PowerZone;
import org.zwolang.model.Tag;
import org.zwolang.model.Value;
import org.zwolang.model.Workout;
import org.zwolang.peg.tree.CstNode;
import org.zwolang.peg.tree.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Turns a ZWOM concrete syntax tree into the value model.
 *
 * <p>Nodes are dispatched on their rule name. Nodes of rules without a dedicated conversion become
 * {@link Visited.Leaf} or {@link Visited.Group}; blocks, parameters, messages and values become
 * {@link Visited.Entry}. Block contents are recovered with two {@link Flatten} passes over the
 * visited block body, one for parameters and one for messages.
 */
final class ZwomVisitor {
    private ZwomVisitor() {}

    /**
     * One {@code KEY value} assignment inside a block body.
     */
    record Param(Tag key, Value value, SourceLocation location) {}

    static Either<ZwomError, Workout> workout(CstNode root) {
        return visit(root).map(visited -> new Workout(Flatten.flatten(visited, Block.class)));
    }

    static Either<ZwomError, Visited> visit(CstNode node) {
        return switch (node.rule()) {
            case "Block" -> block(node);
            case "Assignment" -> assignment(node);
            case "Message" -> message(node);
            case "Range", "Scalar", "Duration", "Percent", "Zone", "Number", "Text" -> value(node).map(Visited::entry);
            default -> generic(node);
        };
    }

    private static Either<ZwomError, Visited> generic(CstNode node) {
        if (node instanceof CstNode.NonTerminal nonTerminal) {
            return visitAll(nonTerminal.children());
        }
        return Either.right(new Visited.Leaf(text(node)));
    }

    private static Either<ZwomError, Visited> visitAll(List<CstNode> nodes) {
        var items = new ArrayList<Visited>(nodes.size());
        for (var child : nodes) {
            var visited = visit(child);
            if (visited.isLeft()) {
                return visited;
            }
            items.add(visited.get());
        }
        return Either.right(new Visited.Group(items));
    }

    // === Blocks and parameters ===

    private static Either<ZwomError, Visited> block(CstNode node) {
        var children = children(node);
        return keyword(children.get(0))
            .flatMap(kind -> visitAll(children.subList(1, children.size()))
                .flatMap(body -> blockOf(kind, body)))
            .map(Visited::entry);
    }

    private static Either<ZwomError, Block> blockOf(Tag kind, Visited body) {
        var params = new LinkedHashMap<Tag, Value>();
        for (var param : Flatten.flatten(body, Param.class)) {
            if (params.containsKey(param.key())) {
                return Either.left(new SyntaxError.InvalidLiteral(param.location(),
                                                                  "Duplicate parameter " + param.key() + " in " + kind + " block"));
            }
            params.put(param.key(), param.value());
        }
        return Either.right(new Block(kind, params, Flatten.flatten(body, Message.class)));
    }

    private static Either<ZwomError, Visited> assignment(CstNode node) {
        var children = children(node);
        var location = node.span().start();
        return keyword(children.get(0))
            .flatMap(key -> value(children.get(1)).map(value -> new Param(key, value, location)))
            .map(Visited::entry);
    }

    private static Either<ZwomError, Visited> message(CstNode node) {
        var children = children(node);
        return duration(children.get(1))
            .map(timestamp -> new Message(timestamp, TextLiterals.unquote(text(children.get(2)))))
            .map(Visited::entry);
    }

    private static Either<ZwomError, Tag> keyword(CstNode node) {
        var keyword = text(node);
        return Tag.fromKeyword(keyword)
                  .toEither(() -> invalid(node, "Unknown keyword '" + keyword + "'"));
    }

    // === Values ===

    private static Either<ZwomError, Value> value(CstNode node) {
        return switch (node.rule()) {
            case "Scalar" -> value(children(node).get(0));
            case "Range" -> range(node);
            case "Duration" -> duration(node).map(Value.class::cast);
            case "Percent" -> digits(node, text(node).substring(0, text(node).length() - 1)).map(Value.Percentage::new);
            case "Zone" -> zone(node);
            case "Number" -> digits(node, text(node)).map(Value.Number::new);
            case "Text" -> Either.right(new Value.Text(TextLiterals.unquote(text(node))));
            default -> Either.left(invalid(node, "Expected a value, found '" + text(node) + "'"));
        };
    }

    private static Either<ZwomError, Value> range(CstNode node) {
        var children = children(node);
        return value(children.get(0))
            .flatMap(left -> value(children.get(children.size() - 1))
                .flatMap(right -> rangeOf(node, left, right)));
    }

    private static Either<ZwomError, Value> rangeOf(CstNode node, Value left, Value right) {
        if (!family(left).equals(family(right))) {
            return Either.left(invalid(node, "Range endpoints must be of the same kind, found "
                                             + family(left) + " and " + family(right)));
        }
        return Either.right(new Value.Range(left, right));
    }

    private static String family(Value value) {
        if (value instanceof Value.Duration) {
            return "duration";
        }
        if (Value.isRelativePower(value)) {
            return "relative power";
        }
        return "number";
    }

    private static Either<ZwomError, Value.Duration> duration(CstNode node) {
        var text = text(node);
        var separator = text.indexOf(':');
        return digits(node, text.substring(0, separator))
            .flatMap(minutes -> digits(node, text.substring(separator + 1))
                .flatMap(seconds -> durationOf(node, minutes, seconds)));
    }

    private static Either<ZwomError, Value.Duration> durationOf(CstNode node, int minutes, int seconds) {
        long total = minutes * 60L + seconds;
        if (total > Integer.MAX_VALUE) {
            return Either.left(invalid(node, "Duration out of range: " + text(node)));
        }
        return Either.right(new Value.Duration((int) total));
    }

    private static Either<ZwomError, Value> zone(CstNode node) {
        var name = text(node);
        return PowerZone.fromName(name)
                        .<Value>map(zone -> zone)
                        .toEither(() -> invalid(node, "Unknown power zone '" + name + "'"));
    }

    private static Either<ZwomError, Integer> digits(CstNode node, String digits) {
        try {
            return Either.right(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return Either.left(invalid(node, "Number out of range: " + digits));
        }
    }

    // === Tree helpers ===

    private static List<CstNode> children(CstNode node) {
        return node instanceof CstNode.NonTerminal nonTerminal
               ? nonTerminal.children()
               : List.of();
    }

    private static String text(CstNode node) {
        if (node instanceof CstNode.Token token) {
            return token.text();
        }
        if (node instanceof CstNode.Terminal terminal) {
            return terminal.text();
        }
        var builder = new StringBuilder();
        for (var child : children(node)) {
            builder.append(text(child));
        }
        return builder.toString();
    }

    private static ZwomError invalid(CstNode node, String reason) {
        return new SyntaxError.InvalidLiteral(node.span().start(), reason);
    }
}
