package org.danilorossi.mailchannel.model;

/** Cosa fare quando il corpo ricade sul body intero e questo è HTML. */
public enum HtmlFallback {
  PASS_THROUGH, // consegna il markup così com'è
  STRIP // converte in testo con Jsoup
}
