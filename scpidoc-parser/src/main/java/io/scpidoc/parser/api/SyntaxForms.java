package io.scpidoc.parser.api;

/**
 * The set and query syntax of a command. Either may be {@code null} when the command does not
 * document it.
 */
public record SyntaxForms(String setForm, String queryForm) {

  public boolean hasSet() {
    return setForm != null && !setForm.isEmpty();
  }

  public boolean hasQuery() {
    return queryForm != null && !queryForm.isEmpty();
  }

  public CommandType commandType() {
    return CommandType.of(hasSet(), hasQuery());
  }
}
