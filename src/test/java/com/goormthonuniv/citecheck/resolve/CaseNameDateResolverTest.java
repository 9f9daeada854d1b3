package com.goormthonuniv.citecheck.resolve;

import com.goormthonuniv.citecheck.Fixtures;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.extract.CitationRuns;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaseNameDateResolverTest {

    private final CaseNameDateResolver resolver = new CaseNameDateResolver(new CiteCheckProperties());

    private List<Citation> resolve(String text) {
        List<Citation> citations = Fixtures.extractor().extract(text);
        CitationRuns.assign(text, citations);
        resolver.resolve(text, citations);
        return citations;
    }

    @Test
    void adversarialNameDirectlyBeforeCitation() {
        List<Citation> out = resolve("In Brown v. Board of Education, 347 U.S. 483 (1954), the Court held that segregation was unconstitutional.");

        assertThat(out).hasSize(1);
        Citation c = out.get(0);
        assertThat(c.getExtractedCaseName()).isEqualTo("Brown v. Board of Education");
        assertThat(c.getExtractedDate()).isEqualTo("1954");
        assertThat(c.getNameConfidence()).isEqualTo(NameStrategy.ADJACENT_ADVERSARIAL.confidence());
    }

    @Test
    void proceduralCaptionKeepsPrefix() {
        Citation c = resolve("See In re Gault, 387 U.S. 1 (1967).").get(0);

        assertThat(c.getExtractedCaseName()).isEqualTo("In re Gault");
        assertThat(c.getExtractedDate()).isEqualTo("1967");
        assertThat(c.getNameConfidence()).isEqualTo(NameStrategy.PROCEDURAL.confidence());
    }

    @Test
    void signalWordsAndPreviousSentenceAreTrimmed() {
        Citation c = resolve("The rule is settled. Cf. Roe v. Wade, 410 U.S. 113 (1973).").get(0);

        assertThat(c.getExtractedCaseName()).isEqualTo("Roe v. Wade");
    }

    @Test
    void parallelCitationsShareNameAndClosingParenthetical() {
        List<Citation> out = resolve("Brown v. Board of Education, 347 U.S. 483, 74 S. Ct. 686 (1954).");

        assertThat(out).hasSize(2);
        assertThat(out).extracting(Citation::getExtractedCaseName)
                .containsOnly("Brown v. Board of Education");
        assertThat(out).extracting(Citation::getExtractedDate).containsOnly("1954");
    }

    @Test
    void nameWindowStopsAtPreviousCitation() {
        List<Citation> out = resolve("Roe v. Wade, 410 U.S. 113 (1973); Doe v. Bolton, 410 U.S. 179 (1973).");

        assertThat(out).extracting(Citation::getExtractedCaseName)
                .containsExactly("Roe v. Wade", "Doe v. Bolton");
    }

    @Test
    void noNameWhenCaptionIsInEarlierSentence() {
        Citation c = resolve("Roe v. Wade was decided. The Court later cited 410 U.S. 113 without naming it.").get(0);

        assertThat(c.getExtractedCaseName()).isNull();
        assertThat(c.getNameConfidence()).isZero();
    }

    @Test
    void californiaStyleYearBeforeCitation() {
        Citation c = resolve("People v. Smith (2004) 34 Cal. 4th 1, 12.").get(0);

        assertThat(c.getExtractedCaseName()).isEqualTo("People v. Smith");
        assertThat(c.getExtractedDate()).isEqualTo("2004");
    }

    @Test
    void databaseCitationFallsBackToEmbeddedYear() {
        Citation c = resolve("Doe v. Acme Corp., 2019 WL 1234567.").get(0);

        assertThat(c.getExtractedDate()).isEqualTo("2019");
    }

    @Test
    void implausibleYearIsDropped() {
        Citation c = resolve("Smith v. Jones, 100 F.3d 200 (2999).").get(0);

        assertThat(c.getExtractedCaseName()).isEqualTo("Smith v. Jones");
        assertThat(c.getExtractedDate()).isNull();
    }

    @Test
    void resolutionIsWriteOnce() {
        List<Citation> out = resolve("Roe v. Wade, 410 U.S. 113 (1973).");

        assertThatThrownBy(() -> resolver.resolve("Roe v. Wade, 410 U.S. 113 (1973).", out))
                .isInstanceOf(IllegalStateException.class);
    }
}
