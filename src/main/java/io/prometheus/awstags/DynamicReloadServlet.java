package io.prometheus.awstags;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DynamicReloadServlet extends HttpServlet {
  private static final long serialVersionUID = -3213629401561436390L;
  private static final Logger LOGGER = Logger.getLogger(DynamicReloadServlet.class.getName());
  private final TagsCollector collector;

  public DynamicReloadServlet(TagsCollector collector) {
    this.collector = collector;
  }

  static final String CONTENT_TYPE = "text/plain";

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp)
      throws ServletException, IOException {
    resp.setStatus(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
    resp.setContentType(CONTENT_TYPE);
    resp.getWriter().print("Only POST requests allowed");
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp)
      throws ServletException, IOException {
    try {
      collector.reloadConfig();
    } catch (IOException | RuntimeException e) {
      // the previous configuration stays active
      LOGGER.log(Level.WARNING, "Configuration reload failed", e);
      resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
      resp.setContentType(CONTENT_TYPE);
      resp.getWriter().print("Reloading config failed");
      return;
    }

    resp.setContentType(CONTENT_TYPE);
    resp.getWriter().print("OK");
  }
}
