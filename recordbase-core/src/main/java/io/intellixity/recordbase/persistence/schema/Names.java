package io.intellixity.recordbase.persistence.schema;

import java.util.regex.Pattern;

/** Name mapping policy shared by generators: camelCase field and type names to snake_case. */
public final class Names {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private Names() {}

  /**
   * - groupId -> group_id\n
   * - PersonView -> person_view\n
   * - HTTPCode -> httpcode\n
   */
  public static String underscore(String s) {
    if (s == null || s.isEmpty()) return s;
    StringBuilder out = new StringBuilder(s.length() + 8);
    char prev = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (Character.isUpperCase(c)) {
        if (i > 0 && prev != '_' && !Character.isUpperCase(prev)) out.append('_');
        out.append(Character.toLowerCase(c));
      } else {
        out.append(c);
      }
      prev = c;
    }
    return out.toString();
  }

  /** Table for a record type: prefix + snake_case(type) + "s". */
  public static String table(String tablePrefix, String type) {
    String prefix = (tablePrefix == null) ? "" : tablePrefix;
    return prefix + underscore(type) + "s";
  }

  public static boolean isIdentifier(String s) {
    return s != null && IDENT.matcher(s).matches();
  }

  public static String requireIdentifier(String s, String what) {
    if (!isIdentifier(s)) throw new IllegalArgumentException("Invalid " + what + " name: " + s);
    return s;
  }
}
