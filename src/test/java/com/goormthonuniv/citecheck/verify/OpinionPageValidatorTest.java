package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.Fixtures;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.service.SimilarityService;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpinionPageValidatorTest {

    static final String BROWN_PAGE = """
            <html><head><title>Brown v. Board of Education, 347 U.S. 483 (1954) :: Justia US Supreme Court Center</title></head>
            <body><nav>Menu</nav><h1>Brown v. Board of Education of Topeka, 347 U.S. 483 (1954)</h1>
            <p>Argued December 9, 1952. Decided May 17, 1954.</p>
            <p>Segregation of white and Negro children in the public schools of a State solely on the basis of race...</p>
            </body></html>
            """;

    private final OpinionPageValidator validator = new OpinionPageValidator(new SimilarityService(), new CiteCheckProperties());

    private final Citation brown = Fixtures.resolved(0, "U.S.", "347", "483", 0, "Brown v. Board of Education", "1954");

    @Test
    void pageOfTheCitedOpinionIsRecognized() {
        OpinionPage page = OpinionPage.parse("https://supreme.justia.com/cases/federal/us/347/483/", BROWN_PAGE);

        OpinionPageValidator.PageVerdict verdict = validator.validate(brown, page);

        assertThat(verdict.caseNameFromTitle()).isEqualTo("Brown v. Board of Education");
        assertThat(verdict.year()).isEqualTo("1954");
        assertThat(verdict.titleNamesCase()).isTrue();
        assertThat(verdict.citationInHeader()).isTrue();
        assertThat(verdict.citingRatherThanCited()).isFalse();
        assertThat(verdict.signal()).isEqualTo(1.0);
    }

    @Test
    void laterOpinionThatMerelyCitesTheCaseIsFlagged() {
        String filler = "The district court granted summary judgment and the plaintiffs appealed. ".repeat(30);
        String html = "<html><head><title>Smith v. Jones, 500 F.3d 100 (9th Cir. 2010)</title></head><body>"
                + "<p>" + filler + "</p><p>As the Court explained in Brown v. Board of Education, 347 U.S. 483, 495 (1954), "
                + "separate is inherently unequal.</p></body></html>";
        OpinionPage page = OpinionPage.parse("https://www.courtlistener.com/opinion/1/smith-v-jones/", html);

        OpinionPageValidator.PageVerdict verdict = validator.validate(brown, page);

        assertThat(verdict.caseNameFromTitle()).isEqualTo("Smith v. Jones");
        assertThat(verdict.titleNamesCase()).isFalse();
        assertThat(verdict.citationInHeader()).isFalse();
        assertThat(verdict.citationInBody()).isTrue();
        assertThat(verdict.citingRatherThanCited()).isTrue();
        assertThat(verdict.signal()).isZero();
    }

    @Test
    void nameSignalIsWeakerWhenNameOnlyInBody() {
        OpinionPage page = OpinionPage.parse("https://www.courtlistener.com/c/U.S./347/483/",
                "<html><head><title>Opinion 105221</title></head><body><p>The Court in Brown v. Board of Education held...</p></body></html>");

        assertThat(validator.nameSignal("Brown v. Board of Education", page)).isEqualTo(0.85);
        assertThat(validator.nameSignal("Roe v. Wade", page)).isZero();
        assertThat(validator.nameSignal(null, page)).isZero();
    }

    @Test
    void citationPatternToleratesSpacingVariants() {
        Citation wash = Fixtures.citation(0, "Wash. 2d", "150", "674", 0);

        assertThat(OpinionPageValidator.citationPattern(wash).matcher("see 150 Wn.2d 674 (2004)").find()).isTrue();
        assertThat(OpinionPageValidator.citationPattern(wash).matcher("150 Wash.2d 674").find()).isTrue();
        assertThat(OpinionPageValidator.citationPattern(wash).matcher("150 Wash. 2d 6745").find()).isFalse();
    }
}
