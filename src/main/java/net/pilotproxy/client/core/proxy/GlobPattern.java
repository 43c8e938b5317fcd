package net.pilotproxy.client.core.proxy;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Shell wildcard pattern with fnmatch(3) semantics under FNM_NOESCAPE.
 *
 * <ul>
 *   <li>{@code *} matches any sequence, {@code ?} any single character, both including {@code /}
 *   <li>{@code [...]} matches a set or range, negated by a leading {@code !} or {@code ^}
 *   <li>{@code ]} directly after the opening bracket is part of the set
 *   <li>POSIX classes such as {@code [:alpha:]} are allowed inside a set, with C locale meaning
 *   <li>a reversed range such as {@code z-a} matches nothing
 *   <li>an unterminated {@code [} and every backslash are literals
 * </ul>
 *
 * <p>Equivalence classes {@code [=c=]} and collating symbols {@code [.c.]} are not recognized;
 * their characters are taken as plain set members.
 */
public final class GlobPattern {
  private final String glob;
  private final Pattern regex;

  private GlobPattern(String glob, Pattern regex) {
    this.glob = glob;
    this.regex = regex;
  }

  /**
   * @param glob shell pattern
   * @return compiled pattern
   * @throws IllegalArgumentException if the pattern is null or names an unknown character class
   */
  public static GlobPattern compile(String glob) {
    if (glob == null) {
      throw new IllegalArgumentException("Pattern cannot be null");
    }
    String regex = toRegex(glob);
    try {
      return new GlobPattern(glob, Pattern.compile(regex, Pattern.DOTALL));
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("Cannot translate pattern " + glob, ex);
    }
  }

  public boolean matches(String value) {
    return value != null && regex.matcher(value).matches();
  }

  public String getGlob() {
    return glob;
  }

  @Override
  public String toString() {
    return glob;
  }

  static String toRegex(String glob) {
    StringBuilder sb = new StringBuilder(glob.length() * 2);
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      switch (c) {
        case '*':
          sb.append(".*");
          i++;
          break;
        case '?':
          sb.append('.');
          i++;
          break;
        case '[':
          int next = appendBracket(sb, glob, i);
          if (next < 0) {
            appendLiteral(sb, c);
            i++;
          } else {
            i = next;
          }
          break;
        default:
          appendLiteral(sb, c);
          i++;
      }
    }
    return sb.toString();
  }

  /**
   * Translates the bracket expression opening at {@code open}. Nothing is appended when the
   * expression is unterminated.
   *
   * @return index after the closing bracket, or -1 when the expression is unterminated
   */
  private static int appendBracket(StringBuilder sb, String glob, int open) {
    int i = open + 1;
    boolean negated = i < glob.length() && isNegation(glob.charAt(i));
    if (negated) {
      i++;
    }

    StringBuilder set = new StringBuilder();
    boolean first = true;
    while (i < glob.length()) {
      char c = glob.charAt(i);
      if (c == ']' && !first) {
        if (set.length() > 0) {
          sb.append(negated ? "[^" : "[").append(set).append(']');
        } else {
          // only reversed ranges, such as [z-a]
          sb.append(negated ? "." : "(?!)");
        }
        return i + 1;
      }
      first = false;

      if (c == '[' && i + 1 < glob.length() && glob.charAt(i + 1) == ':') {
        int close = glob.indexOf(":]", i + 2);
        if (close >= 0) {
          set.append(characterClass(glob.substring(i + 2, close)));
          i = close + 2;
          continue;
        }
      }

      if (i + 2 < glob.length() && glob.charAt(i + 1) == '-' && glob.charAt(i + 2) != ']') {
        char last = glob.charAt(i + 2);
        if (c <= last) {
          appendSetMember(set, c);
          set.append('-');
          appendSetMember(set, last);
        }
        i += 3;
        continue;
      }

      appendSetMember(set, c);
      i++;
    }
    return -1;
  }

  private static String characterClass(String name) {
    switch (name) {
      case "alnum":
        return "\\p{Alnum}";
      case "alpha":
        return "\\p{Alpha}";
      case "blank":
        return "\\p{Blank}";
      case "cntrl":
        return "\\p{Cntrl}";
      case "digit":
        return "\\p{Digit}";
      case "graph":
        return "\\p{Graph}";
      case "lower":
        return "\\p{Lower}";
      case "print":
        return "\\p{Print}";
      case "punct":
        return "\\p{Punct}";
      case "space":
        return "\\p{Space}";
      case "upper":
        return "\\p{Upper}";
      case "xdigit":
        return "\\p{XDigit}";
      default:
        throw new IllegalArgumentException("Unknown character class [:" + name + ":]");
    }
  }

  private static void appendSetMember(StringBuilder set, char c) {
    if (Character.isLetterOrDigit(c)) {
      set.append(c);
    } else {
      set.append('\\').append(c);
    }
  }

  private static void appendLiteral(StringBuilder sb, char c) {
    if (Character.isLetterOrDigit(c)) {
      sb.append(c);
    } else {
      sb.append('\\').append(c);
    }
  }

  private static boolean isNegation(char c) {
    return c == '!' || c == '^';
  }
}
