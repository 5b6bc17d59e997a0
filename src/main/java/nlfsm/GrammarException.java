package nlfsm;

/** Syntax error inside one diagram label line; the parser turns it into a diagnostic. */
public class GrammarException extends IllegalArgumentException {

  private final String code;
  private final int column;

  public GrammarException(String code, String message) {
    this(code, message, -1);
  }

  public GrammarException(String code, String message, int column) {
    super(message);
    this.code = code;
    this.column = column;
  }

  public String code() {
    return code;
  }

  /** Zero-based column inside the parsed fragment, or -1 when unknown. */
  public int column() {
    return column;
  }

  public String describe() {
    return column >= 0 ? getMessage() + " (col " + (column + 1) + ")" : getMessage();
  }
}
