package org.danilorossi.mailchannel.helpers;

import java.util.List;
import lombok.experimental.UtilityClass;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

/** Markdown ⇒ HTML con tabelle, barrato e task list (GFM). */
@UtilityClass
public class MarkdownRenderer {

  private static final List<Extension> EXTENSIONS =
      List.of(
          TablesExtension.create(),
          StrikethroughExtension.create(),
          TaskListItemsExtension.create());

  // Parser e HtmlRenderer sono immutabili e thread-safe
  private static final Parser PARSER = Parser.builder().extensions(EXTENSIONS).build();
  private static final HtmlRenderer RENDERER = HtmlRenderer.builder().extensions(EXTENSIONS).build();

  public static String toHtml(final String markdown) {
    return RENDERER.render(PARSER.parse(LangUtils.nz(markdown)));
  }
}
