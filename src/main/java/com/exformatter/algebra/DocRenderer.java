package com.exformatter.algebra;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders documents to text for a target width.
 * <p>
 * Groups are measured every time they are met, even inside a flat parent.
 * A group is rendered flat when its content, followed by whatever is pending
 * after it, fits in the remaining width up to the next possible line break.
 * Indentation is emitted lazily so empty lines carry no trailing whitespace.
 */
public final class DocRenderer {
    /** Width that never forces a break. */
    public static final int INFINITY = Integer.MAX_VALUE;

    private enum Mode {
        FLAT,
        BREAK,
        // only used while measuring
        FLAT_NO_BREAK,
        BREAK_NO_FLAT
    }

    private record Entry(int indent, Mode mode, Doc doc) {
    }

    /** Persistent stack, so measuring can share the pending tail without copying it. */
    private record Stack(Entry head, Stack tail) {
    }

    private record NewLine(int indent) {
    }

    private record CollapseMark(int max, int indent) {
    }

    private DocRenderer() {
    }

    public static String render(Doc doc, int width) {
        if (width < 0) {
            throw new IllegalArgumentException("width must not be negative, got " + width);
        }
        List<Object> chunks = format(width, Docs.group(doc));
        return assemble(chunks);
    }

    /** Renders with infinite width; only forced breaks and hard lines produce newlines. */
    public static String renderFlat(Doc doc) {
        return render(doc, INFINITY);
    }

    private static Stack push(int indent, Mode mode, Doc doc, Stack tail) {
        return new Stack(new Entry(indent, mode, doc), tail);
    }

    private static List<Object> format(int width, Doc doc) {
        List<Object> chunks = new ArrayList<>();
        Stack stack = push(0, Mode.FLAT, doc, null);
        int column = 0;

        while (stack != null) {
            Entry entry = stack.head();
            stack = stack.tail();
            int indent = entry.indent();
            Mode mode = entry.mode();
            Doc current = entry.doc();

            if (current instanceof Doc.Nil) {
                continue;
            } else if (current instanceof Doc.Line) {
                chunks.add(new NewLine(indent));
                column = indent;
            } else if (current instanceof Doc.Cons cons) {
                stack = push(indent, mode, cons.right(), stack);
                stack = push(indent, mode, cons.left(), stack);
            } else if (current instanceof Doc.Text text) {
                chunks.add(text.text());
                column += text.length();
            } else if (current instanceof Doc.Fits fits) {
                stack = push(indent, mode, fits.doc(), stack);
            } else if (current instanceof Doc.Force force) {
                stack = push(indent, Mode.BREAK, force.doc(), stack);
            } else if (current instanceof Doc.Collapse collapse) {
                chunks.add(new CollapseMark(collapse.max(), indent));
            } else if (current instanceof Doc.Nest nest) {
                if (!nest.breakOnly() || mode == Mode.BREAK) {
                    stack = push(applyNesting(indent, column, nest), mode, nest.doc(), stack);
                } else {
                    stack = push(indent, mode, nest.doc(), stack);
                }
            } else if (current instanceof Doc.Break brk) {
                if (mode == Mode.FLAT) {
                    chunks.add(brk.text());
                    column += brk.text().codePointCount(0, brk.text().length());
                } else {
                    chunks.add(new NewLine(indent));
                    column = indent;
                }
            } else if (current instanceof Doc.Group group) {
                if (mode == Mode.BREAK && group.inherit()) {
                    stack = push(indent, Mode.BREAK, group.doc(), stack);
                } else if (width == INFINITY
                        || fits(width, column, push(indent, Mode.FLAT, group.doc(), stack))) {
                    stack = push(indent, Mode.FLAT, group.doc(), stack);
                } else {
                    stack = push(indent, Mode.BREAK, group.doc(), stack);
                }
            } else {
                throw new IllegalStateException("Unknown document: " + current);
            }
        }

        return chunks;
    }

    private static boolean fits(int width, int column, Stack stack) {
        Stack pending = stack;
        int k = column;

        while (true) {
            if (k > width) {
                return false;
            }
            if (pending == null) {
                return true;
            }

            Entry entry = pending.head();
            pending = pending.tail();
            int indent = entry.indent();
            Mode mode = entry.mode();
            Doc current = entry.doc();

            if (current instanceof Doc.Fits fits) {
                Mode next = !fits.enabled() || mode == Mode.FLAT_NO_BREAK ? Mode.FLAT_NO_BREAK : Mode.BREAK_NO_FLAT;
                pending = push(indent, next, fits.doc(), pending);
                continue;
            }

            if (mode == Mode.BREAK_NO_FLAT) {
                if (current instanceof Doc.Force force) {
                    pending = push(indent, mode, force.doc(), pending);
                    continue;
                }
                if (current instanceof Doc.Break || current instanceof Doc.Line) {
                    return true;
                }
            }

            if (mode == Mode.BREAK) {
                if (current instanceof Doc.Break || current instanceof Doc.Line) {
                    return true;
                }
                if (current instanceof Doc.Group group) {
                    pending = push(indent, Mode.FLAT, group.doc(), pending);
                    continue;
                }
            }

            if (current instanceof Doc.Line) {
                return true;
            } else if (current instanceof Doc.Nil) {
                continue;
            } else if (current instanceof Doc.Collapse) {
                k = indent;
            } else if (current instanceof Doc.Nest nest) {
                int nested = nest.breakOnly() ? indent : applyNesting(indent, k, nest);
                pending = push(nested, mode, nest.doc(), pending);
            } else if (current instanceof Doc.Cons cons) {
                pending = push(indent, mode, cons.right(), pending);
                pending = push(indent, mode, cons.left(), pending);
            } else if (current instanceof Doc.Text text) {
                k += text.length();
            } else if (current instanceof Doc.Force) {
                return false;
            } else if (current instanceof Doc.Break brk) {
                k += brk.text().codePointCount(0, brk.text().length());
            } else if (current instanceof Doc.Group group) {
                pending = push(indent, mode, group.doc(), pending);
            } else {
                throw new IllegalStateException("Unknown document: " + current);
            }
        }
    }

    private static int applyNesting(int indent, int column, Doc.Nest nest) {
        return switch (nest.kind()) {
            case CURSOR -> column;
            case RESET -> 0;
            case COLUMNS -> indent + nest.columns();
        };
    }

    private static String assemble(List<Object> chunks) {
        StringBuilder out = new StringBuilder();
        int pendingIndent = -1;

        for (int index = 0; index < chunks.size(); index++) {
            Object chunk = chunks.get(index);

            if (chunk instanceof String text) {
                if (text.isEmpty()) {
                    continue;
                }
                if (pendingIndent > 0) {
                    out.append(" ".repeat(pendingIndent));
                }
                pendingIndent = -1;
                out.append(text);
            } else if (chunk instanceof NewLine newLine) {
                out.append('\n');
                pendingIndent = newLine.indent();
            } else if (chunk instanceof CollapseMark collapse) {
                int newlines = 0;
                int next = index + 1;
                while (next < chunks.size()) {
                    Object following = chunks.get(next);
                    if (following instanceof NewLine) {
                        newlines++;
                    } else if (!"".equals(following)) {
                        break;
                    }
                    next++;
                }
                index = next - 1;

                if (newlines > 0) {
                    out.append("\n".repeat(Math.min(collapse.max(), newlines)));
                    pendingIndent = collapse.indent();
                } else {
                    if (pendingIndent > 0) {
                        out.append(" ".repeat(pendingIndent));
                    }
                    pendingIndent = -1;
                    out.append(" ".repeat(collapse.indent()));
                }
            }
        }

        return out.toString();
    }
}
