/*
Copyright 2016 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.minesweeper.insight;

import us.blanshard.minesweeper.core.Cell;

import java.util.Arrays;

public class TestHelper {
  public static Cell c(int row, int col) { return Cell.of(row, col); }
  public static Sentence s(int count, Cell... cells) { return new Sentence(Arrays.asList(cells), count); }
}
