package com.example.mcpauth.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // OAuth endpoints
    public static final String AUTHORIZE = "/authorize";
    public static final String CALLBACK = "/callback";
    public static final String TOKEN = "/token";
    public static final String REGISTER = "/register";

    // Discovery
    public static final String WELL_KNOWN = "/.well-known";
    public static final String AUTHORIZATION_SERVER_METADATA = WELL_KNOWN + "/oauth-authorization-server";
    public static final String PROTECTED_RESOURCE_METADATA = WELL_KNOWN + "/oauth-protected-resource";

    // Protected resources
    public static final String MCP_BASE = "/mcp";
    public static final String USER_INFO = "/userinfo";
    public static final String TOOLS = "/tools";
    public static final String TOOL = "/tools/{name}";

    // Health paths
    public static final String HEALTH_BASE = "/health";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  public static final class OAuthParam {
    public static final String CLIENT_ID = "client_id";
    public static final String CLIENT_SECRET = "client_secret";
    public static final String REDIRECT_URI = "redirect_uri";
    public static final String RESPONSE_TYPE = "response_type";
    public static final String STATE = "state";
    public static final String CODE = "code";
    public static final String CODE_CHALLENGE = "code_challenge";
    public static final String CODE_CHALLENGE_METHOD = "code_challenge_method";
    public static final String CODE_VERIFIER = "code_verifier";
    public static final String GRANT_TYPE = "grant_type";
    public static final String SCOPE = "scope";
    public static final String ERROR = "error";
    public static final String ERROR_DESCRIPTION = "error_description";
    public static final String ACTION = "action";

    private OAuthParam() {}
  }

  private ApiConstants() {}
}
