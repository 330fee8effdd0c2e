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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import org.apache.commons.configuration.BaseConfiguration;
import org.apache.commons.configuration.Configuration;
import org.junit.Test;

public class ReflectionUtilsTest {

  public static class ConfiguredThing extends Configured {

  }

  @Test
  public void testNewInstanceIsConfigured() throws Exception {
    Configuration conf = new BaseConfiguration();
    Class<? extends Configured> clazz = ReflectionUtils.loadClass(ConfiguredThing.class.getName(), Configured.class);
    Configured instance = ReflectionUtils.newInstance(clazz, conf);
    assertEquals(ConfiguredThing.class, instance.getClass());
    assertSame(conf, instance.getConf());
  }

  @Test
  public void testLoadClassOfWrongType() throws Exception {
    try {
      ReflectionUtils.loadClass(String.class.getName(), Configured.class);
      fail();
    } catch (ClassCastException e) {
      // expected
    }
  }

  @Test(expected = ClassNotFoundException.class)
  public void testLoadMissingClass() throws Exception {
    ReflectionUtils.loadClass("backup.harness.store.NoSuchStore", ObjectStore.class);
  }

  @Test
  public void testObjectSummaryOrdering() {
    ObjectSummary a = new ObjectSummary("b1", "k2", 1, 0);
    ObjectSummary b = new ObjectSummary("b1", "k10", 1, 0);
    ObjectSummary c = new ObjectSummary("b0", "k9", 1, 0);
    assertEquals(1, Integer.signum(a.compareTo(b)));
    assertEquals(1, Integer.signum(a.compareTo(c)));
    assertEquals(0, a.compareTo(new ObjectSummary("b1", "k2", 5, 5)));
  }

}
