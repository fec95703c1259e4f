package com.chemfetch.sds.link;

import com.chemfetch.sds.config.SearchProperties;
import org.junit.jupiter.api.Test;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinkResolverTest {

    private static final String TARGET = "https://acme.example.org/sds/whiteboard-cleaner.pdf";

    private final LinkResolver resolver = new LinkResolver(new SearchProperties());

    @Test
    void unwrapsBingBase64Redirect() {
        String payload = "a1" + Base64.getUrlEncoder().withoutPadding()
                .encodeToString(TARGET.getBytes(StandardCharsets.UTF_8));

        assertThat(resolver.resolve("https://www.bing.com/ck/a?!&&p=abc&u=" + payload + "&ntb=1"))
                .isEqualTo(TARGET);
    }

    @Test
    void unwrapsBingPercentEncodedRedirect() {
        assertThat(resolver.resolve("https://www.bing.com/ck/a?u=" + enc(TARGET))).isEqualTo(TARGET);
    }

    @Test
    void unwrapsDuckDuckGoRedirect() {
        assertThat(resolver.resolve("https://duckduckgo.com/l/?uddg=" + enc(TARGET) + "&rut=xyz"))
                .isEqualTo(TARGET);
    }

    @Test
    void unwrapsGoogleRedirect() {
        assertThat(resolver.resolve("https://www.google.com.au/url?q=" + enc(TARGET) + "&sa=U"))
                .isEqualTo(TARGET);
    }

    @Test
    void unwrapsDoubleEncodedTarget() {
        assertThat(resolver.resolve("https://duckduckgo.com/l/?uddg=" + enc(enc(TARGET)))).isEqualTo(TARGET);
    }

    @Test
    void leavesDirectLinksAlone() {
        assertThat(resolver.resolve(TARGET)).isEqualTo(TARGET);
        assertThat(resolver.resolve("https://www.bing.com/search?q=cleaner")).isEqualTo("https://www.bing.com/search?q=cleaner");
    }

    @Test
    void keepsWrapperWhenTargetIsPlaceholder() {
        String wrapped = "https://duckduckgo.com/l/?uddg=" + enc("https://example.com/sds.pdf");

        assertThat(resolver.resolve(wrapped)).isEqualTo(wrapped);
    }

    @Test
    void keepsWrapperWhenTargetIsGarbage() {
        String wrapped = "https://www.bing.com/ck/a?u=a1%%%notbase64";

        assertThat(resolver.resolve(wrapped)).isEqualTo(wrapped);
    }

    @Test
    void normaliseMakesRelativeLinksAbsolute() {
        assertThat(resolver.normalise("../docs/sds file.pdf", "https://acme.example.org/products/p1"))
                .contains("https://acme.example.org/docs/sds%20file.pdf");
        assertThat(resolver.normalise("//cdn.acme.example.org/a.pdf", null))
                .contains("https://cdn.acme.example.org/a.pdf");
    }

    @Test
    void normaliseDropsNonHttpLinks() {
        assertThat(resolver.normalise("javascript:void(0)", "https://acme.example.org/")).isEmpty();
        assertThat(resolver.normalise("mailto:sales@acme.example.org", "https://acme.example.org/")).isEmpty();
        assertThat(resolver.normalise("#top", "https://acme.example.org/")).isEmpty();
        assertThat(resolver.normalise("docs/a.pdf", null)).isEmpty();
        assertThat(resolver.normalise("   ", "https://acme.example.org/")).isEmpty();
    }

    @Test
    void dedupeKeyIgnoresWwwSlashAndFragment() {
        assertThat(resolver.dedupeKey("https://www.Acme.example.org/sds/#section1"))
                .isEqualTo(resolver.dedupeKey("https://acme.example.org/sds"));
        assertThat(resolver.dedupeKey("https://acme.example.org/sds?id=1"))
                .isNotEqualTo(resolver.dedupeKey("https://acme.example.org/sds?id=2"));
    }

    @Test
    void hostChecks() {
        assertThat(resolver.isSearchEngineHosted("https://www.bing.com/search?q=x")).isTrue();
        assertThat(resolver.isSearchEngineHosted(TARGET)).isFalse();
        assertThat(resolver.isPlaceholder("https://example.com/a.pdf")).isTrue();
        assertThat(LinkResolver.hostMatches("https://www.ebay.com.au/itm/1", List.of("ebay."))).isTrue();
        assertThat(LinkResolver.hostOf("not a url")).isEmpty();
    }

    @Test
    void a1PrefixDetection() {
        assertThat(LinkResolver.isProbablyA1Base64("a1aHR0cHM6Ly9")).isTrue();
        assertThat(LinkResolver.isProbablyA1Base64("https://x")).isFalse();
        assertThat(LinkResolver.isProbablyA1Base64("a1")).isFalse();
    }

    private static String enc(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
