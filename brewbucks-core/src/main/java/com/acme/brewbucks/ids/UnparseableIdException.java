package com.acme.brewbucks.ids;

/** The text is not a well-formed identifier. */
public class UnparseableIdException extends IdParseException {

  public enum Defect {
    MISSING_DIVIDER,
    WRONG_LENGTH,
    BAD_ENCODING
  }

  private final Defect defect;

  public UnparseableIdException(String input, Defect defect, String detail) {
    super(input, describe(input, defect, detail));
    this.defect = defect;
  }

  public UnparseableIdException(String input, Defect defect, String detail, Throwable cause) {
    super(input, describe(input, defect, detail), cause);
    this.defect = defect;
  }

  public Defect getDefect() {
    return defect;
  }

  private static String describe(String input, Defect defect, String detail) {
    return String.format("Unparseable identifier '%s' (%s): %s", input, defect, detail);
  }
}
