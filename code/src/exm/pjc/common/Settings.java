/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.pjc.common;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.io.IOUtils;

import exm.pjc.common.exceptions.InvalidOptionException;
import exm.pjc.common.exceptions.PJCRuntimeError;
import exm.pjc.common.util.Pair;

/**
 * General PJC settings
 * @author wozniak
 *
 * Values are read from Java properties of the same name, falling back
 * to the defaults set here.
 * */
public class Settings
{
  public static final String LOG_FILE = "pjc.log.file";
  public static final String LOG_TRACE = "pjc.log.trace";

  public static final String IC_OUTPUT_FILE = "pjc.ic.output-file";

  public static final String CODEGEN_INDENT_WIDTH = "pjc.codegen.indent-width";
  /** One of cumulative or flat */
  public static final String CODEGEN_INDENT_POLICY = "pjc.codegen.indent-policy";
  public static final String CODEGEN_RENAME_RESERVED =
                                            "pjc.codegen.rename-reserved";

  public static final String OUTPUT_HEADER = "pjc.output.header";
  public static final String OUTPUT_DIR = "pjc.output.dir";

  public static final String INPUT_FILENAME = "pjc.input_filename";
  public static final String OUTPUT_FILENAME = "pjc.output_filename";
  public static final String PJC_VERSION = "pjc.version";

  public static final List<String> INDENT_POLICIES =
                      Collections.unmodifiableList(
                          Arrays.asList("cumulative", "flat"));

  private static final String VERSION_RESOURCE = "/pjc-version.txt";

  private static final int MAX_INDENT_WIDTH = 16;

  private static final Properties properties;

  /** Additional metadata */
  private static final List<Pair<String, String>> metadata =
            new ArrayList<Pair<String, String>>();

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(IC_OUTPUT_FILE, "");
    defaults.setProperty(CODEGEN_INDENT_WIDTH, "4");
    defaults.setProperty(CODEGEN_INDENT_POLICY, "cumulative");
    defaults.setProperty(CODEGEN_RENAME_RESERVED, "false");
    defaults.setProperty(OUTPUT_HEADER, "true");
    defaults.setProperty(OUTPUT_DIR, "outputs");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(PJC_VERSION, "unknown");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initPJCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
    loadVersionNumber();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, returning key to its default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static void addMetadata(String key, String val) {
    metadata.add(Pair.create(key, val));
  }

  public static List<Pair<String, String>> getMetadata() {
    return Collections.unmodifiableList(metadata);
  }

  private static void loadVersionNumber() {
    InputStream in = Settings.class.getResourceAsStream(VERSION_RESOURCE);
    if (in == null) {
      throw new PJCRuntimeError("Version resource missing: "
                                + VERSION_RESOURCE);
    }
    try {
      String version = IOUtils.toString(in, StandardCharsets.UTF_8).trim();
      properties.setProperty(PJC_VERSION, version);
    } catch (IOException e) {
      throw new PJCRuntimeError("IOException while reading version resource: "
                              + VERSION_RESOURCE + ": " + e.getMessage());
    } finally {
      IOUtils.closeQuietly(in);
    }
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(CODEGEN_RENAME_RESERVED);
    getBoolean(OUTPUT_HEADER);

    long width = getLong(CODEGEN_INDENT_WIDTH);
    if (width < 1 || width > MAX_INDENT_WIDTH) {
      throw new InvalidOptionException("Expected property "
          + CODEGEN_INDENT_WIDTH + " to be between 1 and " + MAX_INDENT_WIDTH
          + " but was " + width);
    }

    checkOneOf(CODEGEN_INDENT_POLICY, INDENT_POLICIES);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {

    boolean found = false;
    // Case insensitive
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    String lcaseVal = val.toLowerCase();
    for (String vv: validVals) {
      if (lcaseVal.equals(vv.toLowerCase())) {
        found = true;
        break;
      }
    }

    if (!found) {
      StringBuilder sb = new StringBuilder();
      for (String vv: validVals) {
        if (sb.length() > 0) {
          sb.append(", ");
        }
        sb.append("'");
        sb.append(vv);
        sb.append("'");
      }
      throw new InvalidOptionException("Expected property " + key + " to be one of: "
          + sb.toString() + " but was '" + val + "'");
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
