package io.flowrules.core.engine.strict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowrules.core.error.RuleParseException;
import io.flowrules.core.rule.NavDirective;
import io.flowrules.core.rule.VisibilityDirective;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link DirectiveCache}. */
class DirectiveCacheTest {

    @Test
    void enabledCacheReturnsTheSameParsedList() {
        DirectiveCache cache = new DirectiveCache(true);

        List<VisibilityDirective> first = cache.visibility("skip_if(a = 1)", "q1");
        List<VisibilityDirective> second = cache.visibility("skip_if(a = 1)", "q2");

        assertThat(second).isSameAs(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void visibilityAndNavigationEntriesAreSeparate() {
        DirectiveCache cache = new DirectiveCache(true);

        cache.visibility("", "q1");
        List<NavDirective> navigation = cache.navigation("", "q1");

        assertThat(navigation).isEmpty();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void parseFailuresAreNotCached() {
        DirectiveCache cache = new DirectiveCache(true);

        assertThatThrownBy(() -> cache.navigation("goto_if(true)", "q1")).isInstanceOf(RuleParseException.class);
        assertThatThrownBy(() -> cache.navigation("goto_if(true)", "q1")).isInstanceOf(RuleParseException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    void disabledCacheParsesEveryTime() {
        DirectiveCache cache = DirectiveCache.disabled();

        List<VisibilityDirective> first = cache.visibility("skip_if(a = 1)", "q1");
        List<VisibilityDirective> second = cache.visibility("skip_if(a = 1)", "q1");

        assertThat(cache.isEnabled()).isFalse();
        assertThat(second).isNotSameAs(first).isEqualTo(first);
        assertThat(cache.size()).isZero();
    }
}
