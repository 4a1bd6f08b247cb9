package io.calcexpr.core.lexer;

import java.util.Arrays;

/**
 * Rewrites calculator glyphs into their ASCII spelling and drops all spaces, remembering where
 * every normalized character came from in the raw input.
 *
 * <p>Replacements: {@code × -> *}, {@code ÷ -> /}, {@code − -> -}, {@code π -> PI}, {@code √ ->
 * sqrt}, {@code ∛ -> cbrt}.
 */
public final class InputNormalizer {

  /**
   * Normalized text plus the raw offset of each of its characters.
   *
   * @param text the normalized text
   * @param rawLength length of the raw input
   */
  public record Normalized(String text, int[] offsets, int rawLength) {

    public Normalized {
      offsets = offsets.clone();
    }

    /** Raw offset of each normalized character; a copy, changes do not affect this instance. */
    @Override
    public int[] offsets() {
      return offsets.clone();
    }

    /**
     * Maps a normalized index back to the raw input.
     *
     * @param index index into {@link #text()}, may equal its length
     * @return the corresponding raw offset; the raw length for the end position
     */
    public int rawOffset(int index) {
      return index < offsets.length ? offsets[index] : rawLength;
    }

    /** Raw end offset (exclusive) of a normalized range ending at {@code endIndex}. */
    public int rawEnd(int endIndex) {
      return endIndex == 0 ? 0 : rawOffset(endIndex - 1) + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Normalized other
          && text.equals(other.text)
          && rawLength == other.rawLength
          && Arrays.equals(offsets, other.offsets);
    }

    @Override
    public int hashCode() {
      return 31 * text.hashCode() + Arrays.hashCode(offsets);
    }

    @Override
    public String toString() {
      return "Normalized[" + text + "]";
    }
  }

  private InputNormalizer() {}

  public static Normalized normalize(String raw) {
    StringBuilder text = new StringBuilder(raw.length());
    int[] offsets = new int[raw.length() * 4];
    int n = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (isSpace(c)) {
        continue;
      }
      String replacement = replacement(c);
      for (int k = 0; k < replacement.length(); k++) {
        text.append(replacement.charAt(k));
        offsets[n++] = i;
      }
    }
    return new Normalized(text.toString(), Arrays.copyOf(offsets, n), raw.length());
  }

  // Includes no-break and other Unicode space separators that isWhitespace leaves out
  private static boolean isSpace(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c);
  }

  private static String replacement(char c) {
    return switch (c) {
      case '×' -> "*";
      case '÷' -> "/";
      case '−' -> "-";
      case 'π' -> "PI";
      case '√' -> "sqrt";
      case '∛' -> "cbrt";
      default -> String.valueOf(c);
    };
  }
}
