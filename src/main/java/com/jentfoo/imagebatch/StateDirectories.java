package com.jentfoo.imagebatch;

import java.io.File;

/**
 * Per user folders for config, session state and log files.  Rooted at {@code ~/.imagebatch} 
 * unless the {@code imagebatch.home} system property points elsewhere.
 */
public class StateDirectories {
  public static final String HOME_PROPERTY = "imagebatch.home";
  private static final String DEFAULT_FOLDER_NAME = ".imagebatch";

  public static File getHome() {
    String home = System.getProperty(HOME_PROPERTY);
    if (home != null && ! home.trim().isEmpty()) {
      return new File(home);
    }

    return new File(System.getProperty("user.home"), DEFAULT_FOLDER_NAME);
  }

  public static File getConfigFolder() {
    return new File(getHome(), "config");
  }

  public static File getStateFolder() {
    return new File(getHome(), "state");
  }

  public static File getLogFolder() {
    return new File(getHome(), "logs");
  }
}
