package io.prometheus.awstags;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class TagFilterTest {
  private final List<Tag> tags =
      Arrays.asList(new Tag("Environment", "production"), new Tag("Team", "payments"));

  @Test
  public void emptySearchAlwaysMatches() {
    assertTrue(TagFilter.matches(tags, Collections.emptyList()));
    assertTrue(TagFilter.matches(Collections.emptyList(), Collections.emptyList()));
  }

  @Test
  public void untaggedResourceFailsAnySearch() {
    assertFalse(
        TagFilter.matches(
            Collections.emptyList(), Collections.singletonList(new Tag("Team", "payments"))));
  }

  @Test
  public void allSearchTagsMustMatch() {
    assertTrue(TagFilter.matches(tags, Collections.singletonList(new Tag("Team", "payments"))));
    assertTrue(
        TagFilter.matches(
            tags, Arrays.asList(new Tag("Team", "payments"), new Tag("Environment", "production"))));
    assertFalse(
        TagFilter.matches(
            tags, Arrays.asList(new Tag("Team", "payments"), new Tag("Environment", "staging"))));
  }

  @Test
  public void keyAndValueMatchExactly() {
    assertFalse(TagFilter.matches(tags, Collections.singletonList(new Tag("team", "payments"))));
    assertFalse(TagFilter.matches(tags, Collections.singletonList(new Tag("Team", "Payments"))));
    assertFalse(TagFilter.matches(tags, Collections.singletonList(new Tag("Team", "pay.*"))));
    assertFalse(TagFilter.matches(tags, Collections.singletonList(new Tag("payments", "Team"))));
  }
}
