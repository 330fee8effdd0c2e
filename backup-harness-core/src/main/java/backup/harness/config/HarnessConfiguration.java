/*
 * Copyright 2016 Fortitude Technologies LLC
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
 * limitations under the License.
 */
package backup.harness.config;

import java.net.URL;

import org.apache.commons.configuration.CompositeConfiguration;
import org.apache.commons.configuration.Configuration;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.apache.commons.configuration.SystemConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the harness settings. System properties take precedence over the
 * optional {@value #RESOURCE} on the classpath.
 */
public class HarnessConfiguration {

  private final static Logger LOG = LoggerFactory.getLogger(HarnessConfiguration.class);

  public static final String RESOURCE = "backup-harness.properties";

  public static Configuration load() throws ConfigurationException {
    return load(RESOURCE);
  }

  public static Configuration load(String resource) throws ConfigurationException {
    CompositeConfiguration configuration = new CompositeConfiguration();
    configuration.addConfiguration(new SystemConfiguration());
    URL url = HarnessConfiguration.class.getClassLoader()
                                        .getResource(resource);
    if (url != null) {
      LOG.info("Loading harness configuration from {}", url);
      configuration.addConfiguration(new PropertiesConfiguration(url));
    } else {
      LOG.info("No {} found on the classpath, using system properties only", resource);
    }
    return configuration;
  }

}
