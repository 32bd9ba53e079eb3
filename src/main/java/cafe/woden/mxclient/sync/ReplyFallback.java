package cafe.woden.mxclient.sync;

/**
 * Quoted reply fallbacks older clients put at the top of a reply body:
 *
 * <pre>
 * &gt; &lt;@alice:example.org&gt; original text
 * &gt; more original text
 *
 * the actual reply
 * </pre>
 */
final class ReplyFallback {

  /** {@code sender} and {@code quote} are {@code null} when the body carried no fallback. */
  record Parsed(String sender, String quote, String body) {
    boolean hasQuote() {
      return quote != null;
    }
  }

  private ReplyFallback() {}

  static Parsed parse(String body) {
    if (body == null) return new Parsed(null, null, "");
    if (!body.startsWith("> <")) return new Parsed(null, null, body);

    String[] lines = body.split("\n", -1);
    String first = lines[0];
    int close = first.indexOf("> ", 3);
    if (close < 0 || !first.substring(0, close + 1).endsWith(">")) {
      return new Parsed(null, null, strip(body));
    }
    String sender = first.substring(3, close);
    StringBuilder quote = new StringBuilder(first.substring(close + 2));
    int i = 1;
    while (i < lines.length && lines[i].startsWith(">")) {
      String line = lines[i].startsWith("> ") ? lines[i].substring(2) : lines[i].substring(1);
      quote.append('\n').append(line);
      i++;
    }
    if (i < lines.length && lines[i].isEmpty()) i++;
    return new Parsed(sender, quote.toString(), join(lines, i));
  }

  /** Drops leading quoted lines and the blank separator line after them. */
  static String strip(String body) {
    if (body == null) return "";
    String[] lines = body.split("\n", -1);
    int i = 0;
    while (i < lines.length && lines[i].startsWith(">")) i++;
    if (i == 0) return body;
    if (i < lines.length && lines[i].isEmpty()) i++;
    return join(lines, i);
  }

  private static String join(String[] lines, int from) {
    StringBuilder sb = new StringBuilder();
    for (int j = from; j < lines.length; j++) {
      if (j > from) sb.append('\n');
      sb.append(lines[j]);
    }
    return sb.toString();
  }
}
