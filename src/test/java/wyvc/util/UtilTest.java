// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyvc.util;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class UtilTest {

    @Test
    public void test_map() {
        List<Integer> lengths = Util.map(Arrays.asList("a", "bb", "ccc"), String::length);
        assertEquals(Arrays.asList(1, 2, 3), lengths);
    }

    @Test
    public void test_append() {
        assertEquals(Arrays.asList(1, 2, 3), Util.append(Arrays.asList(1), Arrays.asList(2, 3)));
    }

    @Test
    public void test_select() {
        assertEquals(Arrays.asList("c", "a"), Util.select(Arrays.asList("a", "b", "c"), Arrays.asList(2, 0)));
    }
}
