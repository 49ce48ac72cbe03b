package ai.formula.translator.rewrite;

import ai.formula.translator.formula.TokenKind;
import ai.formula.translator.formula.TokenStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Recovers function-call structure from a flat token stream.
 */
public final class CallNodeParser {

    private CallNodeParser() {
    }

    /**
     * Returns every complete call in order of its name position, i.e. outer calls before the calls they contain.
     */
    public static List<CallNode> parse(TokenStream tokens) {
        List<CallNode> nodes = new ArrayList<>();
        Deque<Frame> frames = new ArrayDeque<>();
        int index = 0;
        while (index < tokens.size()) {
            TokenKind kind = tokens.get(index).kind();
            if (kind == TokenKind.FUNCTION_NAME
                    && index + 1 < tokens.size()
                    && tokens.get(index + 1).is(TokenKind.OPEN_PAREN)) {
                frames.push(new Frame(index, index + 1, enclosingCall(frames)));
                index += 2;
                continue;
            }
            switch (kind) {
                case OPEN_PAREN, OPEN_ARRAY -> frames.push(new Frame(-1, index, -1));
                case ARGUMENT_SEPARATOR -> {
                    Frame top = frames.peek();
                    if (top != null && top.isCall()) {
                        top.closeArgument(index);
                    }
                }
                case CLOSE_PAREN, CLOSE_ARRAY -> {
                    Frame top = frames.poll();
                    if (top != null && top.isCall()) {
                        top.closeArgument(index);
                        nodes.add(new CallNode(top.nameIndex, top.openIndex, index, top.arguments, top.enclosingNameIndex));
                    }
                }
                default -> {
                }
            }
            index++;
        }
        nodes.sort(Comparator.comparingInt(CallNode::nameIndex));
        return List.copyOf(nodes);
    }

    private static int enclosingCall(Deque<Frame> frames) {
        for (Frame frame : frames) {
            if (frame.isCall()) {
                return frame.nameIndex;
            }
        }
        return -1;
    }

    private static final class Frame {
        private final int nameIndex;
        private final int openIndex;
        private final int enclosingNameIndex;
        private final List<CallNode.Span> arguments = new ArrayList<>();
        private int argumentStart;

        private Frame(int nameIndex, int openIndex, int enclosingNameIndex) {
            this.nameIndex = nameIndex;
            this.openIndex = openIndex;
            this.enclosingNameIndex = enclosingNameIndex;
            this.argumentStart = openIndex + 1;
        }

        private boolean isCall() {
            return nameIndex >= 0;
        }

        private void closeArgument(int separatorIndex) {
            arguments.add(new CallNode.Span(argumentStart, separatorIndex));
            argumentStart = separatorIndex + 1;
        }
    }
}
