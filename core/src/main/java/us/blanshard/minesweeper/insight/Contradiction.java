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

/**
 * Thrown when the facts given to or derived by a {@link KnowledgeBase} can't
 * all be true: a cell both safe and a mine, or a sentence claiming more mines
 * than it has cells (or fewer than none).  Means either the board lied or the
 * inference is broken; either way there's nothing sensible to continue with.
 */
public class Contradiction extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public Contradiction(String message) {
    super(message);
  }
}
