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
package backup.harness.store;

import org.apache.commons.configuration.Configuration;

public class ReflectionUtils {

  public static <T> T newInstance(Class<T> clazz, Configuration conf) throws Exception {
    T instance = clazz.getDeclaredConstructor()
                      .newInstance();
    if (conf != null) {
      if (instance instanceof Configured) {
        Configured configured = (Configured) instance;
        configured.setConf(conf);
      }
    }
    return instance;
  }

  @SuppressWarnings("unchecked")
  public static <T> Class<? extends T> loadClass(String classname, Class<T> baseClass) throws ClassNotFoundException {
    Class<?> clazz = baseClass.getClassLoader()
                              .loadClass(classname);
    if (!baseClass.isAssignableFrom(clazz)) {
      throw new ClassCastException("Class " + classname + " is not a " + baseClass.getName());
    }
    return (Class<? extends T>) clazz;
  }
}
