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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class Util {

    /**
     * Map a given list of elements from one kind to another.
     *
     * @param items
     * @param fn
     * @param <S>
     * @param <T>
     * @return
     */
    public static <S, T> List<T> map(List<? extends S> items, Function<S, T> fn) {
        ArrayList<T> rs = new ArrayList<>();
        for (int i = 0; i != items.size(); ++i) {
            rs.add(fn.apply(items.get(i)));
        }
        return rs;
    }

    /**
     * Functional list append. This creates a fresh list containing both
     * <code>left</code> and <code>right</code> operands.
     *
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<? extends T> left, List<? extends T> right) {
        ArrayList<T> result = new ArrayList<>(left);
        result.addAll(right);
        return result;
    }

    /**
     * Select the elements of a list at the given positions, in the order the
     * positions are given.
     *
     * @param items
     * @param indices
     * @param <T>
     * @return
     */
    public static <T> List<T> select(List<? extends T> items, List<Integer> indices) {
        ArrayList<T> result = new ArrayList<>();
        for (int i : indices) {
            result.add(items.get(i));
        }
        return result;
    }
}
