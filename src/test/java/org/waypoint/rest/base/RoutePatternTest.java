package org.waypoint.rest.base;

import io.undertow.util.Methods;
import org.junit.jupiter.api.Test;
import org.waypoint.rest.ConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutePatternTest {

    @Test
    void method_and_template() {
        RoutePattern pattern = RoutePattern.parse("GET /users/{id}/posts/{postId}");

        assertThat(pattern.getMethod()).isEqualTo(Methods.GET);
        assertThat(pattern.isAnyMethod()).isFalse();
        assertThat(pattern.getTemplate()).isEqualTo("/users/{id}/posts/{postId}");
        assertThat(pattern.getShape()).isEqualTo("/users/{}/posts/{}");
        assertThat(pattern.getParameterNames()).containsExactly("id", "postId");
    }

    @Test
    void method_token_is_upper_cased() {
        RoutePattern pattern = RoutePattern.parse("get /x");

        assertThat(pattern.getMethod().toString()).isEqualTo("GET");
        assertThat(pattern.getPattern()).isEqualTo("get /x");
    }

    @Test
    void no_method_means_any() {
        RoutePattern pattern = RoutePattern.parse("/health");

        assertThat(pattern.isAnyMethod()).isTrue();
        assertThat(pattern.getMethod()).isNull();
        assertThat(pattern.getParameterNames()).isEmpty();
    }

    @Test
    void root_and_trailing_slash() {
        assertThat(RoutePattern.parse("/").getShape()).isEqualTo("/");
        assertThat(RoutePattern.parse("/docs/").getShape()).isEqualTo("/docs/");
    }

    @Test
    void surrounding_whitespace_is_ignored() {
        RoutePattern pattern = RoutePattern.parse("  POST   /items ");

        assertThat(pattern.getMethod()).isEqualTo(Methods.POST);
        assertThat(pattern.getTemplate()).isEqualTo("/items");
    }

    @Test
    void blank() {
        assertThatThrownBy(() -> RoutePattern.parse(" "))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessage("Malformed pattern \" \": pattern is blank");
    }

    @Test
    void missing_leading_slash() {
        assertThatThrownBy(() -> RoutePattern.parse("GET users"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessage("Malformed pattern \"GET users\": path must start with '/'");
    }

    @Test
    void invalid_method() {
        assertThatThrownBy(() -> RoutePattern.parse("G(T /x"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessage("Malformed pattern \"G(T /x\": invalid method \"G(T\"");
    }

    @Test
    void whitespace_inside_path() {
        assertThatThrownBy(() -> RoutePattern.parse("GET /a b"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("path contains whitespace");
    }

    @Test
    void empty_segment() {
        assertThatThrownBy(() -> RoutePattern.parse("/a//b"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("empty path segment");
    }

    @Test
    void parameter_must_fill_the_segment() {
        assertThatThrownBy(() -> RoutePattern.parse("/files/img{id}"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("parameter must span a whole segment, got \"img{id}\"");
    }

    @Test
    void parameter_name_must_be_an_identifier() {
        assertThatThrownBy(() -> RoutePattern.parse("/files/{}"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("invalid parameter name \"\"");
        assertThatThrownBy(() -> RoutePattern.parse("/files/{path...}"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("invalid parameter name \"path...\"");
    }

    @Test
    void parameter_names_are_unique() {
        assertThatThrownBy(() -> RoutePattern.parse("/{id}/{id}"))
                .isExactlyInstanceOf(ConfigurationException.class)
                .hasMessageEndingWith("parameter \"id\" appears more than once");
    }
}
