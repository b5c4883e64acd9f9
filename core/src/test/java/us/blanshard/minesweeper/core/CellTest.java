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
package us.blanshard.minesweeper.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class CellTest {

  @Test public void neighbors() {
    assertThat(Cell.of(0, 0).neighbors(3, 3))
        .containsExactly(Cell.of(0, 1), Cell.of(1, 0), Cell.of(1, 1)).inOrder();
    assertThat(Cell.of(0, 1).neighbors(3, 3)).hasSize(5);
    assertThat(Cell.of(1, 1).neighbors(3, 3)).hasSize(8);
    assertThat(Cell.of(1, 1).neighbors(3, 3)).doesNotContain(Cell.of(1, 1));
    assertThat(Cell.of(0, 0).neighbors(1, 1)).isEmpty();
    assertThat(Cell.of(0, 1).neighbors(1, 3)).containsExactly(Cell.of(0, 0), Cell.of(0, 2));
  }

  @Test public void all() {
    assertThat(Cell.all(2, 3)).containsExactly(
        Cell.of(0, 0), Cell.of(0, 1), Cell.of(0, 2),
        Cell.of(1, 0), Cell.of(1, 1), Cell.of(1, 2)).inOrder();
  }

  @Test public void isWithin() {
    assertTrue(Cell.of(1, 2).isWithin(2, 3));
    assertFalse(Cell.of(2, 2).isWithin(2, 3));
    assertFalse(Cell.of(1, 3).isWithin(2, 3));
  }

  @Test public void valueSemantics() {
    assertEquals(Cell.of(3, 4), Cell.of(3, 4));
    assertEquals(Cell.of(3, 4).hashCode(), Cell.of(3, 4).hashCode());
    assertFalse(Cell.of(3, 4).equals(Cell.of(4, 3)));
    assertEquals("(3, 4)", Cell.of(3, 4).toString());
  }

  @Test public void ordering() {
    assertThat(Cell.of(0, 5)).isLessThan(Cell.of(1, 0));
    assertThat(Cell.of(1, 0)).isLessThan(Cell.of(1, 1));
    assertEquals(0, Cell.of(2, 2).compareTo(Cell.of(2, 2)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeCoordinates() {
    Cell.of(-1, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptyBoard() {
    Cell.all(0, 3);
  }
}
