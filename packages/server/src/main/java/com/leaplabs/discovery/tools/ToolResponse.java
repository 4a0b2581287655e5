package com.leaplabs.discovery.tools;

import com.leaplabs.discovery.exception.ErrorDetails;
import com.leaplabs.discovery.utility.JacksonUtility;

/** JSON text returned to the calling agent, flagged when it describes an error. */
public record ToolResponse(String content, boolean error) {

  public static ToolResponse ok(Object body) {
    return new ToolResponse(JacksonUtility.toJson(body), false);
  }

  public static ToolResponse error(ErrorDetails details) {
    return new ToolResponse(JacksonUtility.toJson(details), true);
  }
}
