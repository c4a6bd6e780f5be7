package ai.jira.adapter.markdown;

import ai.jira.adapter.adf.MarkType;
import ai.jira.adapter.adf.TextRun;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the inline text of one block into a flat list of marked text runs.
 *
 * <p>Code spans are cut out first and stay verbatim; links and images are matched next; emphasis delimiters are
 * paired last with an opener stack. A delimiter that cannot be paired is emitted as literal text. Emphasis never
 * spans a code span, so no run carries the code mark together with anything but a link.
 */
public class InlineResolver {

    private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
    private static final Pattern AUTOLINK = Pattern.compile("<((?:https?|ftp)://[^\\s<>]+|mailto:[^\\s<>]+)>");

    public List<TextRun> resolve(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        RunCollector runs = new RunCollector();
        emit(tokenize(text, 0, text.length(), true), new EnumMap<>(MarkType.class), Optional.empty(), runs);
        return runs.finish();
    }

    private List<Token> tokenize(String text, int from, int to, boolean allowLinks) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        LinkScanner links = new LinkScanner(text, to);
        int index = from;
        while (index < to) {
            char ch = text.charAt(index);
            if (ch == '\\' && index + 1 < to && isAsciiPunctuation(text.charAt(index + 1))) {
                literal.append(text.charAt(index + 1));
                index += 2;
                continue;
            }
            if (ch == '`') {
                int run = runLength(text, index, to, '`');
                int close = findBacktickRun(text, index + run, to, run);
                if (close < 0) {
                    literal.append(text, index, index + run);
                    index += run;
                    continue;
                }
                flush(literal, tokens);
                tokens.add(new CodeSpan(codeContent(text.substring(index + run, close))));
                index = close + run;
                continue;
            }
            if (ch == '*' || ch == '_' || ch == '~') {
                int run = runLength(text, index, to, ch);
                if (ch == '~' && run < 2) {
                    literal.append(ch);
                    index++;
                    continue;
                }
                flush(literal, tokens);
                char before = index > from ? text.charAt(index - 1) : ' ';
                char after = index + run < to ? text.charAt(index + run) : ' ';
                tokens.add(Delimiter.of(ch, run, before, after, tokens.size()));
                index += run;
                continue;
            }
            if (allowLinks && (ch == '[' || (ch == '!' && index + 1 < to && text.charAt(index + 1) == '['))) {
                boolean image = ch == '!';
                Optional<LinkSyntax> link = links.match(image ? index + 1 : index);
                if (link.isPresent()) {
                    flush(literal, tokens);
                    tokens.add(linkToken(text, link.get(), image));
                    index = link.get().end();
                    continue;
                }
            }
            if (allowLinks && ch == '<') {
                Matcher autolink = AUTOLINK.matcher(text).region(index, to);
                if (autolink.lookingAt()) {
                    flush(literal, tokens);
                    String url = autolink.group(1);
                    tokens.add(new LinkSpan(List.of(new Literal(url)), url));
                    index = autolink.end();
                    continue;
                }
            }
            literal.append(ch);
            index++;
        }
        flush(literal, tokens);
        pairDelimiters(tokens);
        return tokens;
    }

    private LinkSpan linkToken(String text, LinkSyntax link, boolean image) {
        if (link.textStart() == link.textEnd()) {
            return new LinkSpan(List.of(new Literal(link.href())), link.href());
        }
        if (image) {
            // images degrade to a link labelled with their alt text
            return new LinkSpan(List.of(new Literal(text.substring(link.textStart(), link.textEnd()))), link.href());
        }
        return new LinkSpan(tokenize(text, link.textStart(), link.textEnd(), false), link.href());
    }

    private static void pairDelimiters(List<Token> tokens) {
        List<Delimiter> openers = new ArrayList<>();
        int lastBoundary = -1;
        for (int index = 0; index < tokens.size(); index++) {
            Token token = tokens.get(index);
            if (isCodeBoundary(token)) {
                lastBoundary = index;
                continue;
            }
            if (!(token instanceof Delimiter delimiter)) {
                continue;
            }
            if (delimiter.canClose) {
                closeAgainst(delimiter, openers, lastBoundary);
            }
            if (delimiter.canOpen && delimiter.remaining > 0) {
                openers.add(delimiter);
            }
        }
    }

    private static void closeAgainst(Delimiter closer, List<Delimiter> openers, int lastBoundary) {
        while (closer.remaining > 0) {
            int position = findOpener(closer, openers, lastBoundary);
            if (position < 0) {
                return;
            }
            Delimiter opener = openers.get(position);
            int used = closer.marker == '~' || (opener.remaining >= 2 && closer.remaining >= 2) ? 2 : 1;
            MarkType mark = closer.marker == '~' ? MarkType.STRIKE : used == 2 ? MarkType.STRONG : MarkType.EM;
            opener.remaining -= used;
            closer.remaining -= used;
            opener.opens.add(mark);
            closer.closes.add(mark);
            // openers inside the matched pair stay literal
            openers.subList(position + 1, openers.size()).clear();
            if (opener.remaining == 0) {
                openers.remove(position);
            }
        }
    }

    private static int findOpener(Delimiter closer, List<Delimiter> openers, int lastBoundary) {
        for (int i = openers.size() - 1; i >= 0; i--) {
            Delimiter candidate = openers.get(i);
            if (candidate.position < lastBoundary) {
                return -1;
            }
            if (candidate.marker != closer.marker) {
                continue;
            }
            if (closer.marker == '~' && (candidate.remaining < 2 || closer.remaining < 2)) {
                continue;
            }
            return i;
        }
        return -1;
    }

    private static boolean isCodeBoundary(Token token) {
        return token instanceof CodeSpan || (token instanceof LinkSpan link && link.containsCode());
    }

    private static void emit(List<Token> tokens, Map<MarkType, Integer> active, Optional<String> href,
                             RunCollector runs) {
        for (Token token : tokens) {
            if (token instanceof Literal literal) {
                runs.add(literal.text(), activeMarks(active, href), href);
            } else if (token instanceof CodeSpan code) {
                Set<MarkType> marks = EnumSet.of(MarkType.CODE);
                if (href.isPresent()) {
                    marks.add(MarkType.LINK);
                }
                runs.add(code.text(), marks, href);
            } else if (token instanceof LinkSpan link) {
                emit(link.children(), active, Optional.of(link.href()), runs);
            } else if (token instanceof Delimiter delimiter) {
                delimiter.closes.forEach(mark -> active.merge(mark, -1, Integer::sum));
                runs.add(String.valueOf(delimiter.marker).repeat(delimiter.remaining), activeMarks(active, href), href);
                delimiter.opens.forEach(mark -> active.merge(mark, 1, Integer::sum));
            }
        }
    }

    private static Set<MarkType> activeMarks(Map<MarkType, Integer> active, Optional<String> href) {
        Set<MarkType> marks = EnumSet.noneOf(MarkType.class);
        active.forEach((mark, count) -> {
            if (count > 0) {
                marks.add(mark);
            }
        });
        if (href.isPresent()) {
            marks.add(MarkType.LINK);
        }
        return marks;
    }

    private static void flush(StringBuilder literal, List<Token> tokens) {
        if (literal.length() > 0) {
            tokens.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static int runLength(String text, int from, int to, char ch) {
        int index = from;
        while (index < to && text.charAt(index) == ch) {
            index++;
        }
        return index - from;
    }

    private static int findBacktickRun(String text, int from, int to, int length) {
        int index = from;
        while (index < to) {
            if (text.charAt(index) == '`') {
                int run = runLength(text, index, to, '`');
                if (run == length) {
                    return index;
                }
                index += run;
            } else {
                index++;
            }
        }
        return -1;
    }

    private static String codeContent(String raw) {
        if (raw.length() >= 2 && raw.startsWith(" ") && raw.endsWith(" ") && !raw.isBlank()) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }

    private static boolean isAsciiPunctuation(char ch) {
        return ASCII_PUNCTUATION.indexOf(ch) >= 0;
    }

    private static boolean isPunctuation(char ch) {
        if (isAsciiPunctuation(ch)) {
            return true;
        }
        int type = Character.getType(ch);
        return type == Character.CONNECTOR_PUNCTUATION
                || type == Character.DASH_PUNCTUATION
                || type == Character.START_PUNCTUATION
                || type == Character.END_PUNCTUATION
                || type == Character.INITIAL_QUOTE_PUNCTUATION
                || type == Character.FINAL_QUOTE_PUNCTUATION
                || type == Character.OTHER_PUNCTUATION;
    }

    private interface Token {
    }

    private record Literal(String text) implements Token {
    }

    private record CodeSpan(String text) implements Token {
    }

    private record LinkSpan(List<Token> children, String href) implements Token {

        boolean containsCode() {
            return children.stream().anyMatch(CodeSpan.class::isInstance);
        }
    }

    private static final class Delimiter implements Token {

        private final char marker;
        private final boolean canOpen;
        private final boolean canClose;
        private final int position;
        private final List<MarkType> opens = new ArrayList<>();
        private final List<MarkType> closes = new ArrayList<>();
        private int remaining;

        private Delimiter(char marker, int count, boolean canOpen, boolean canClose, int position) {
            this.marker = marker;
            this.remaining = count;
            this.canOpen = canOpen;
            this.canClose = canClose;
            this.position = position;
        }

        static Delimiter of(char marker, int count, char before, char after, int position) {
            boolean beforeSpace = Character.isWhitespace(before);
            boolean afterSpace = Character.isWhitespace(after);
            boolean leftFlanking = !afterSpace
                    && (!isPunctuation(after) || beforeSpace || isPunctuation(before));
            boolean rightFlanking = !beforeSpace
                    && (!isPunctuation(before) || afterSpace || isPunctuation(after));
            boolean canOpen = leftFlanking;
            boolean canClose = rightFlanking;
            if (marker == '_') {
                canOpen = leftFlanking && (!rightFlanking || isPunctuation(before));
                canClose = rightFlanking && (!leftFlanking || isPunctuation(after));
            }
            return new Delimiter(marker, count, canOpen, canClose, position);
        }
    }

    /**
     * Link bracket/paren structure found at an opening bracket.
     */
    private record LinkSyntax(int textStart, int textEnd, String href, int end) {

        private static String destination(String raw) {
            String trimmed = raw.strip();
            if (trimmed.startsWith("<")) {
                int end = trimmed.indexOf('>');
                if (end > 0) {
                    return trimmed.substring(1, end);
                }
            }
            for (int i = 0; i < trimmed.length(); i++) {
                if (Character.isWhitespace(trimmed.charAt(i))) {
                    return trimmed.substring(0, i);
                }
            }
            return trimmed;
        }
    }

    /**
     * Finds link syntax inside one span of text. When a scan from an opener reaches the end of the span without
     * closing, every bracket match on its path is kept, and later openers on that path are answered from it.
     */
    private static final class LinkScanner {

        private final String text;
        private final int to;
        private final Matches brackets;
        private final Matches parens;

        LinkScanner(String text, int to) {
            this.text = text;
            this.to = to;
            this.brackets = new Matches('[', ']', true);
            this.parens = new Matches('(', ')', false);
        }

        Optional<LinkSyntax> match(int open) {
            int close = brackets.closing(open);
            if (close < 0 || close + 1 >= to || text.charAt(close + 1) != '(') {
                return Optional.empty();
            }
            int paren = parens.closing(close + 1);
            if (paren < 0) {
                return Optional.empty();
            }
            String destination = LinkSyntax.destination(text.substring(close + 2, paren));
            if (destination.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new LinkSyntax(open + 1, close, destination, paren + 1));
        }

        private final class Matches {

            private final char opener;
            private final char closer;
            private final boolean skipsCode;
            private int pathStart = -1;
            private BitSet onPath;
            private int[] matched;

            Matches(char opener, char closer, boolean skipsCode) {
                this.opener = opener;
                this.closer = closer;
                this.skipsCode = skipsCode;
            }

            int closing(int open) {
                if (onPath != null && open >= pathStart && onPath.get(open - pathStart)) {
                    return matched[open - pathStart];
                }
                int depth = 0;
                int index = open;
                while (index < to) {
                    char ch = text.charAt(index);
                    int next = skip(index, ch);
                    if (next > index) {
                        index = next;
                        continue;
                    }
                    if (ch == opener) {
                        depth++;
                    } else if (ch == closer) {
                        depth--;
                        if (depth == 0) {
                            return index;
                        }
                    }
                    index++;
                }
                remember(open);
                return -1;
            }

            private void remember(int start) {
                pathStart = start;
                onPath = new BitSet(to - start);
                matched = new int[to - start];
                Arrays.fill(matched, -1);
                Deque<Integer> open = new ArrayDeque<>();
                int index = start;
                while (index < to) {
                    char ch = text.charAt(index);
                    onPath.set(index - start);
                    int next = skip(index, ch);
                    if (next > index) {
                        index = next;
                        continue;
                    }
                    if (ch == opener) {
                        open.push(index);
                    } else if (ch == closer && !open.isEmpty()) {
                        matched[open.pop() - start] = index;
                    }
                    index++;
                }
            }

            /**
             * Index after an escape or code span starting at {@code index}, or {@code index} itself.
             */
            private int skip(int index, char ch) {
                if (ch == '\\') {
                    return index + 2;
                }
                if (skipsCode && ch == '`') {
                    int run = runLength(text, index, to, '`');
                    int close = findBacktickRun(text, index + run, to, run);
                    return close < 0 ? index + run : close + run;
                }
                return index;
            }
        }
    }

    private static final class RunCollector {

        private final List<TextRun> runs = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();
        private Set<MarkType> pendingMarks = Set.of();
        private Optional<String> pendingHref = Optional.empty();

        void add(String text, Set<MarkType> marks, Optional<String> href) {
            if (text.isEmpty()) {
                return;
            }
            if (pending.length() > 0 && (!pendingMarks.equals(marks) || !pendingHref.equals(href))) {
                flush();
            }
            pending.append(text);
            pendingMarks = marks;
            pendingHref = href;
        }

        List<TextRun> finish() {
            flush();
            return List.copyOf(runs);
        }

        private void flush() {
            if (pending.length() > 0) {
                runs.add(new TextRun(pending.toString(), pendingMarks, pendingHref));
                pending.setLength(0);
            }
        }
    }
}
