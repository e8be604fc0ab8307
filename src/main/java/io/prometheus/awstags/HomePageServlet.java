package io.prometheus.awstags;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

public class HomePageServlet extends HttpServlet {
  private static final long serialVersionUID = 6204185263010487514L;

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp)
      throws ServletException, IOException {
    resp.setContentType("text/html");
    resp.getWriter()
        .print(
            "<html>\n"
                + "<head><title>AWS Tags Exporter</title></head>\n"
                + "<body>\n"
                + "<h1>AWS Tags Exporter</h1>\n"
                + "<p><a href=\"/metrics\">Metrics</a></p>\n"
                + "<p>Reload the configuration with <code>POST /-/reload</code>.</p>\n"
                + "</body>\n"
                + "</html>");
  }
}
