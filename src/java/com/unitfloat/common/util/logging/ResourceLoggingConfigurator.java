// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.unitfloat.common.util.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.io.Closeables;

/**
 * A java.util.logging configuration class that loads the logging configuration from a properties
 * resource on the classpath instead of a file.  The resource is looked up at /logging.properties
 * unless the system property {@link #LOGGING_PROPERTIES_RESOURCE_PATH
 * java.util.logging.config.resource} names another path.  To install it set the system property
 * java.util.logging.config.class=com.unitfloat.common.util.logging.ResourceLoggingConfigurator
 */
public class ResourceLoggingConfigurator {

  /**
   * A system property that controls where ResourceLoggingConfigurator looks for the logging
   * configuration on the process classpath.
   */
  public static final String LOGGING_PROPERTIES_RESOURCE_PATH = "java.util.logging.config.resource";

  public static final String DEFAULT_RESOURCE = "/logging.properties";

  public ResourceLoggingConfigurator() throws IOException {
    this(System.getProperty(LOGGING_PROPERTIES_RESOURCE_PATH, DEFAULT_RESOURCE),
        LogManager.getLogManager());
  }

  @VisibleForTesting
  ResourceLoggingConfigurator(String resourcePath, LogManager logManager) throws IOException {
    Preconditions.checkNotNull(resourcePath);
    Preconditions.checkNotNull(logManager);
    InputStream loggingConfig = getClass().getResourceAsStream(resourcePath);
    Preconditions.checkNotNull(loggingConfig,
        "Could not locate logging config file at resource path: %s", resourcePath);
    try {
      logManager.readConfiguration(loggingConfig);
    } finally {
      Closeables.closeQuietly(loggingConfig);
    }
  }
}
