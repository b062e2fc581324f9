// Copyright 2026 The Bazel Authors. All rights reserved.
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
package net.starlark.skytest.discovery;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import net.starlark.skytest.discovery.TestDiscovery.PathKind;
import net.starlark.skytest.discovery.TestDiscovery.Selection;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TestDiscoveryTest {

  private FileSystem fs;
  private TestDiscovery discovery;

  @Before
  public void setUp() throws IOException {
    fs = Jimfs.newFileSystem(Configuration.unix());
    discovery = new TestDiscovery(fs, TestDiscovery.DEFAULT_PATTERNS, /* recursive= */ true);
    touch("/work/a_test.star");
    touch("/work/test_b.star");
    touch("/work/helper.star");
    touch("/work/sub/c_test.star");
    touch("/work/.hidden/d_test.star");
  }

  @After
  public void tearDown() throws IOException {
    fs.close();
  }

  private void touch(String path) throws IOException {
    Path p = fs.getPath(path);
    Files.createDirectories(p.getParent());
    Files.write(p, "".getBytes(UTF_8));
  }

  private ImmutableList<String> expand(String... args) throws Exception {
    return discovery.expandPaths(ImmutableList.copyOf(args)).stream()
        .map(Path::toString)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void isTestFile() {
    assertThat(discovery.isTestFile(fs.getPath("/x/foo_test.star"))).isTrue();
    assertThat(discovery.isTestFile(fs.getPath("test_foo.star"))).isTrue();
    assertThat(discovery.isTestFile(fs.getPath("/x/foo.star"))).isFalse();
    assertThat(discovery.isTestFile(fs.getPath("/x/foo_test.py"))).isFalse();
  }

  @Test
  public void classifyPath() {
    assertThat(discovery.classifyPath("/work")).isEqualTo(PathKind.DIRECTORY);
    assertThat(discovery.classifyPath("/work/a_test.star")).isEqualTo(PathKind.FILE);
    assertThat(discovery.classifyPath("/missing.star")).isEqualTo(PathKind.FILE);
    assertThat(discovery.classifyPath("/work/*_test.star")).isEqualTo(PathKind.GLOB);
  }

  @Test
  public void directory_recursesSkippingHiddenDirectories() throws Exception {
    assertThat(expand("/work"))
        .containsExactly("/work/a_test.star", "/work/sub/c_test.star", "/work/test_b.star")
        .inOrder();
  }

  @Test
  public void directory_nonRecursive() throws Exception {
    discovery = new TestDiscovery(fs, ImmutableList.of(), /* recursive= */ false);
    assertThat(expand("/work")).containsExactly("/work/a_test.star", "/work/test_b.star");
  }

  @Test
  public void glob_matchesWithinItsDepth() throws Exception {
    assertThat(expand("/work/*_test.star")).containsExactly("/work/a_test.star");
  }

  @Test
  public void explicitFile_keptEvenIfNotMatchingPatterns() throws Exception {
    assertThat(expand("/work/helper.star")).containsExactly("/work/helper.star");
  }

  @Test
  public void duplicatesAreRemovedInFirstSeenOrder() throws Exception {
    assertThat(expand("/work/test_b.star", "/work"))
        .containsExactly("/work/test_b.star", "/work/a_test.star", "/work/sub/c_test.star")
        .inOrder();
  }

  @Test
  public void duplicatesAreRecognizedAcrossSpellings() throws Exception {
    assertThat(fs.getPath("").toAbsolutePath().toString()).isEqualTo("/work");

    assertThat(expand("sub", "./sub/c_test.star", "/work/sub/../sub/c_test.star"))
        .containsExactly("sub/c_test.star");
  }

  @Test
  public void emptyExpansion_throws() {
    NoTestFilesFoundException e =
        assertThrows(NoTestFilesFoundException.class, () -> expand("/work/sub/*_nothing.star"));
    assertThat(e.getPaths()).containsExactly("/work/sub/*_nothing.star");
  }

  @Test
  public void parseSelectors() {
    Selection selection =
        TestDiscovery.parseSelectors(
            ImmutableList.of(
                "/work/a_test.star::test_one", "/work", "/work/a_test.star::test_two"));
    assertThat(selection.paths())
        .containsExactly("/work/a_test.star", "/work", "/work/a_test.star")
        .inOrder();
    assertThat(selection.testNamesFor(fs.getPath("/work/a_test.star")))
        .containsExactly("test_one", "test_two")
        .inOrder();
    assertThat(selection.testNamesFor(fs.getPath("/work/test_b.star"))).isEmpty();
  }

  @Test
  public void discoverTests_staticallyAndSorted() throws Exception {
    byte[] source =
        ("def test_b():\n  pass\ndef helper():\n  pass\ndef test_a():\n  pass\n").getBytes(UTF_8);
    assertThat(TestDiscovery.discoverTests("x_test.star", source, ""))
        .containsExactly("test_a", "test_b")
        .inOrder();
    assertThat(TestDiscovery.discoverTests("x_test.star", source, "help"))
        .containsExactly("helper");
  }
}
