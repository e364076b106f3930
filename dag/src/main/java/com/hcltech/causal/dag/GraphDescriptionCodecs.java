package com.hcltech.causal.dag;

import com.hcltech.causal.common.codec.Codec;
import com.hcltech.causal.common.errorsor.ErrorsOr;

import java.util.*;

/**
 * Wire formats for {@link GraphDescription}.
 * <ul>
 *     <li>{@link #json()}: {@code {"variables":["A","B"],"edges":[{"from":"A","to":"B"}]}}</li>
 *     <li>{@link #edgeList()}: one {@code from -> to} per line, or a bare name declaring a variable with no edges.
 *     Blank lines and lines starting with {@code #} are ignored. Variables are ordered by first appearance.</li>
 * </ul>
 */
public final class GraphDescriptionCodecs {
    static final String ARROW = "->";

    private GraphDescriptionCodecs() {}

    public static Codec<GraphDescription, String> json() {
        return Codec.clazzCodec(GraphDescription.class);
    }

    public static Codec<GraphDescription, String> edgeList() {
        return new EdgeListCodec();
    }

    /** Decode then build; decoding errors and graph errors come back through the same channel. */
    public static ErrorsOr<CausalGraph> parse(Codec<GraphDescription, String> codec, String text) {
        return codec.decode(text).flatMap(CausalGraphBuilder::build);
    }

    static final class EdgeListCodec implements Codec<GraphDescription, String> {
        private final Codec<List<List<String>>, String> lines = Codec.lines(new LineCodec());

        @Override
        public ErrorsOr<String> encode(GraphDescription description) {
            List<List<String>> out = new ArrayList<>();
            Set<String> touched = new HashSet<>();
            for (Edge e : description.edges()) {
                out.add(List.of(e.from(), e.to()));
                touched.add(e.from());
                touched.add(e.to());
            }
            for (String v : description.variables()) {
                if (!touched.contains(v)) out.add(List.of(v));
            }
            return lines.encode(out);
        }

        @Override
        public ErrorsOr<GraphDescription> decode(String text) {
            return lines.decode(text).map(entries -> {
                Set<String> variables = new LinkedHashSet<>();
                List<Edge> edges = new ArrayList<>();
                for (List<String> entry : entries) {
                    variables.addAll(entry);
                    if (entry.size() == 2) edges.add(new Edge(entry.get(0), entry.get(1)));
                }
                return new GraphDescription(new ArrayList<>(variables), edges);
            });
        }
    }

    /** A line is {@code []} (blank/comment), {@code [name]} or {@code [from, to]}. */
    static final class LineCodec implements Codec<List<String>, String> {
        @Override
        public ErrorsOr<String> encode(List<String> entry) {
            for (String name : entry) {
                ErrorsOr<String> checked = checkName(name);
                if (checked.isError()) return checked;
            }
            if (entry.size() == 1) return ErrorsOr.lift(entry.get(0));
            if (entry.size() == 2) return ErrorsOr.lift(entry.get(0) + " " + ARROW + " " + entry.get(1));
            return ErrorsOr.error("Cannot encode entry " + entry);
        }

        @Override
        public ErrorsOr<List<String>> decode(String line) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) return ErrorsOr.lift(List.of());
            int arrow = trimmed.indexOf(ARROW);
            if (arrow < 0) return checkName(trimmed).map(name -> List.of(name));
            if (trimmed.indexOf(ARROW, arrow + ARROW.length()) >= 0) {
                return ErrorsOr.error("Expected a single '" + ARROW + "' in: " + trimmed);
            }
            String from = trimmed.substring(0, arrow).strip();
            String to = trimmed.substring(arrow + ARROW.length()).strip();
            ErrorsOr<String> f = checkName(from);
            ErrorsOr<String> t = checkName(to);
            if (f.isError() || t.isError()) {
                List<String> errors = new ArrayList<>(f.getErrors());
                errors.addAll(t.getErrors());
                return ErrorsOr.errors(errors);
            }
            return ErrorsOr.lift(List.of(from, to));
        }

        private static ErrorsOr<String> checkName(String name) {
            if (name.isEmpty()) return ErrorsOr.error("Missing variable name");
            if (name.contains(ARROW) || name.chars().anyMatch(Character::isWhitespace) || name.startsWith("#")) {
                return ErrorsOr.error("Invalid variable name '" + name + "'");
            }
            return ErrorsOr.lift(name);
        }
    }
}
