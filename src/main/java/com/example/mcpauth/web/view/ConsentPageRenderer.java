package com.example.mcpauth.web.view;

import com.example.mcpauth.domain.entity.AuthorizationRequest;
import com.example.mcpauth.domain.entity.ConsentDetails;
import com.example.mcpauth.web.rest.ApiConstants.ApiPath;
import com.example.mcpauth.web.rest.ApiConstants.OAuthParam;
import org.springframework.stereotype.Component;

import static org.springframework.web.util.HtmlUtils.htmlEscape;

/**
 * Renders the consent page. Every interpolated value is HTML-escaped; the form posts the
 * original authorize parameters back together with {@code action=approve|deny}.
 */
@Component
public class ConsentPageRenderer {

  public static final String ACTION_APPROVE = "approve";
  public static final String ACTION_DENY = "deny";

  public String render(ConsentDetails details) {
    StringBuilder html = new StringBuilder(2048);
    html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n")
        .append("<meta charset=\"utf-8\">\n")
        .append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">\n")
        .append("<title>").append(htmlEscape(details.serverName())).append(" | Authorization Request</title>\n")
        .append("<style>")
        .append("body{font-family:system-ui,sans-serif;background:#f5f5f7;margin:0;padding:2rem;}")
        .append(".card{max-width:480px;margin:0 auto;background:#fff;border-radius:8px;padding:2rem;")
        .append("box-shadow:0 2px 8px rgba(0,0,0,.1);}")
        .append("dt{font-weight:600;margin-top:.75rem;}dd{margin:0;word-break:break-all;}")
        .append(".actions{display:flex;gap:1rem;margin-top:1.5rem;}")
        .append("button{flex:1;padding:.75rem;border-radius:6px;border:1px solid #ccc;font-size:1rem;cursor:pointer;}")
        .append("button.approve{background:#0070f3;color:#fff;border-color:#0070f3;}")
        .append("</style>\n</head>\n<body>\n<div class=\"card\">\n")
        .append("<h1>").append(htmlEscape(details.serverName())).append("</h1>\n")
        .append("<p><strong>").append(htmlEscape(details.clientName()))
        .append("</strong> is requesting access to your account.</p>\n")
        .append("<dl>\n")
        .append("<dt>Client ID</dt><dd>").append(htmlEscape(details.clientId())).append("</dd>\n")
        .append("<dt>Redirect URI</dt><dd>").append(htmlEscape(details.redirectUri())).append("</dd>\n");

    if (!details.scopes().isEmpty()) {
      html.append("<dt>Requested scopes</dt><dd><ul>");
      details.scopes().forEach(scope -> html.append("<li>").append(htmlEscape(scope)).append("</li>"));
      html.append("</ul></dd>\n");
    }
    html.append("</dl>\n");

    html.append("<form method=\"post\" action=\"").append(ApiPath.AUTHORIZE).append("\">\n");
    AuthorizationRequest request = details.request();
    hidden(html, OAuthParam.CLIENT_ID, request.clientId());
    hidden(html, OAuthParam.REDIRECT_URI, request.redirectUri());
    hidden(html, OAuthParam.RESPONSE_TYPE, request.responseType());
    hidden(html, OAuthParam.STATE, request.state());
    hidden(html, OAuthParam.CODE_CHALLENGE, request.codeChallenge());
    hidden(html, OAuthParam.CODE_CHALLENGE_METHOD, request.codeChallengeMethod());
    hidden(html, OAuthParam.SCOPE, request.scope());
    html.append("<div class=\"actions\">\n")
        .append("<button type=\"submit\" name=\"action\" value=\"").append(ACTION_DENY).append("\">Deny</button>\n")
        .append("<button type=\"submit\" name=\"action\" value=\"").append(ACTION_APPROVE)
        .append("\" class=\"approve\">Approve</button>\n")
        .append("</div>\n</form>\n</div>\n</body>\n</html>\n");
    return html.toString();
  }

  private static void hidden(StringBuilder html, String name, String value) {
    if (value == null) {
      return;
    }
    html.append("<input type=\"hidden\" name=\"").append(name)
        .append("\" value=\"").append(htmlEscape(value)).append("\">\n");
  }
}
