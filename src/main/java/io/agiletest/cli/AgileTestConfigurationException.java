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

/**
 * Raised for invalid credentials setup, unsupported framework types and missing file type mappings.
 * Always thrown before any request leaves the process.
 */
public class AgileTestConfigurationException extends IllegalArgumentException {
  public AgileTestConfigurationException(String message) {
    super(message);
  }

  public AgileTestConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
