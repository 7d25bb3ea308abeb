package fun.fengwk.smh.core.utils;

import java.text.BreakIterator;
import java.util.Locale;

/**
 * Truncation that never splits a user-perceived character.
 *
 * @author fengwk
 */
public final class TextTruncation {

    private TextTruncation() {
    }

    /**
     * Cut {@code text} to at most {@code maxLength} chars. When {@code maxLength} is not a character
     * boundary the cut moves back to the preceding one.
     *
     * @param text      text to cut, may be null
     * @param maxLength max chars to keep, non-positive yields an empty string
     * @return truncated text, or null when {@code text} is null
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        if (maxLength <= 0) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        BreakIterator iterator = BreakIterator.getCharacterInstance(Locale.ROOT);
        iterator.setText(text);
        int end = iterator.isBoundary(maxLength) ? maxLength : iterator.preceding(maxLength);
        if (end == BreakIterator.DONE) {
            end = 0;
        }
        return text.substring(0, end);
    }

}
