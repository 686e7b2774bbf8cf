package com.microsoft.finops.scope;

import com.microsoft.finops.domain.model.CloudProvider;
import com.microsoft.finops.domain.model.CostRecord;
import com.microsoft.finops.exception.InvalidScopeExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeExpressionParserTest {

    private static CostRecord record(CloudProvider cloud, String account, String service, Map<String, String> tags) {
        return CostRecord.builder()
                .cloud(cloud)
                .accountId(account)
                .service(service)
                .region("us-east-1")
                .tags(tags)
                .build();
    }

    @Nested
    @DisplayName("Parsing Tests")
    class ParsingTests {

        @Test
        @DisplayName("Should treat blank and * as the unrestricted scope")
        void shouldParseEverything() {
            assertThat(ScopeExpressionParser.parse(null).isUnrestricted()).isTrue();
            assertThat(ScopeExpressionParser.parse("  ").isUnrestricted()).isTrue();
            assertThat(ScopeExpressionParser.parse("*")).isEqualTo(CostFilter.all());
        }

        @Test
        @DisplayName("Should parse every dimension")
        void shouldParseAllDimensions() {
            // When
            CostFilter filter = ScopeExpressionParser.parse(
                    "cloud=AWS,gcp; account=A1,A2; project=p1; service=EC2; region=us-east-1; tag:Team=backend,data");

            // Then
            assertThat(filter.clouds()).containsExactlyInAnyOrder(CloudProvider.AWS, CloudProvider.GCP);
            assertThat(filter.accounts()).containsExactly("A1", "A2");
            assertThat(filter.projects()).containsExactly("p1");
            assertThat(filter.services()).containsExactly("ec2");
            assertThat(filter.regions()).containsExactly("us-east-1");
            assertThat(filter.tags()).containsOnlyKeys("team");
            assertThat(filter.tags().get("team")).containsExactly("backend", "data");
        }

        @Test
        @DisplayName("Should format to a canonical expression that parses back to the same filter")
        void shouldFormatCanonically() {
            // Given
            CostFilter filter = ScopeExpressionParser.parse("tag:team=b,a;cloud=GCP,AWS");

            // When
            String formatted = ScopeExpressionParser.format(filter);

            // Then
            assertThat(formatted).isEqualTo("cloud=AWS,GCP; tag:team=a,b");
            assertThat(ScopeExpressionParser.parse(formatted)).isEqualTo(filter);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "cloud",
                "=AWS",
                "cloud=",
                "cloud=AWS,",
                "cloud=MARS",
                "owner=me",
                "tag:=x",
                "account=A1; account=A2"
        })
        @DisplayName("Should reject malformed expressions")
        void shouldRejectMalformed(String expression) {
            assertThatThrownBy(() -> ScopeExpressionParser.parse(expression))
                    .isInstanceOf(InvalidScopeExpressionException.class);
        }
    }

    @Nested
    @DisplayName("Matching Tests")
    class MatchingTests {

        @Test
        @DisplayName("Should require every clause to match")
        void shouldMatchConjunction() {
            // Given
            CostFilter filter = ScopeExpressionParser.parse("cloud=AWS; tag:team=backend");

            // Then
            assertThat(filter.matches(record(CloudProvider.AWS, "A1", "EC2", Map.of("team", "backend")))).isTrue();
            assertThat(filter.matches(record(CloudProvider.GCP, "A1", "EC2", Map.of("team", "backend")))).isFalse();
            assertThat(filter.matches(record(CloudProvider.AWS, "A1", "EC2", Map.of("team", "data")))).isFalse();
            assertThat(filter.matches(record(CloudProvider.AWS, "A1", "EC2", Map.of()))).isFalse();
        }

        @Test
        @DisplayName("Should compare services ignoring case")
        void shouldMatchServiceIgnoringCase() {
            CostFilter filter = ScopeExpressionParser.parse("service=ec2");

            assertThat(filter.matches(record(CloudProvider.AWS, "A1", "EC2", Map.of()))).isTrue();
            assertThat(filter.matches(record(CloudProvider.AWS, "A1", "S3", Map.of()))).isFalse();
        }
    }
}
