// SPDX-License-Identifier: Apache-2.0
/* Copyright 2025 AgileTest CLI Authors & Contributors

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License. */

package io.agiletest.cli;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a test framework to the file extension of its result report, and that extension to a mime type.
 */
public class ResultFileTypes {

  //── Default tables ──────────────────────────────────────────────────────────────
  private static final Map<String, String> FRAMEWORK_EXTENSIONS = new LinkedHashMap<>();
  private static final Map<String, String> MIME_TYPES = new LinkedHashMap<>();

  static {
    FRAMEWORK_EXTENSIONS.put("junit", "xml");
    FRAMEWORK_EXTENSIONS.put("nunit", "xml");
    FRAMEWORK_EXTENSIONS.put("xunit", "xml");
    FRAMEWORK_EXTENSIONS.put("testng", "xml");
    FRAMEWORK_EXTENSIONS.put("robot", "xml");
    FRAMEWORK_EXTENSIONS.put("cucumber", "json");
    FRAMEWORK_EXTENSIONS.put("behave", "json");

    MIME_TYPES.put("xml", "application/xml");
    MIME_TYPES.put("json", "application/json");
  }

  public static final ResultFileTypes DEFAULT =
      new ResultFileTypes(FRAMEWORK_EXTENSIONS.keySet(), FRAMEWORK_EXTENSIONS, MIME_TYPES);

  public record FileType(String extension, String mimeType) {}

  private final Set<String> supportedFrameworks;
  private final Map<String, String> frameworkExtensions;
  private final Map<String, String> mimeTypes;

  public ResultFileTypes(
      Collection<String> supportedFrameworks,
      Map<String, String> frameworkExtensions,
      Map<String, String> mimeTypes
  ) {
    this.supportedFrameworks = Collections.unmodifiableSet(new LinkedHashSet<>(supportedFrameworks));
    this.frameworkExtensions = Map.copyOf(frameworkExtensions);
    this.mimeTypes = Map.copyOf(mimeTypes);
  }

  public List<String> supportedFrameworks() {
    return new ArrayList<>(supportedFrameworks);
  }

  /**
   * Normalizes the framework type to lower case and checks it is one AgileTest accepts.
   *
   * @return the normalized framework type
   * @throws AgileTestConfigurationException if the framework type is not supported
   */
  public String checkFramework(String frameworkType) {
    String normalized = frameworkType == null ? "" : frameworkType.trim().toLowerCase(Locale.ROOT);
    if (!supportedFrameworks.contains(normalized)) {
      throw new AgileTestConfigurationException(
          "Invalid test execution type: " + frameworkType + ". Supported frameworks: " + supportedFrameworks());
    }
    return normalized;
  }

  /**
   * Looks up the extension for the framework, then the mime type for that extension.
   *
   * @throws AgileTestConfigurationException if either mapping is missing
   */
  public FileType resolve(String framework) {
    String extension = frameworkExtensions.get(framework);
    if (extension == null) {
      throw new AgileTestConfigurationException("Extension not found for framework type " + framework);
    }
    String mimeType = mimeTypes.get(extension);
    if (mimeType == null) {
      throw new AgileTestConfigurationException("Mime type not found for extension " + extension);
    }
    return new FileType(extension, mimeType);
  }
}
