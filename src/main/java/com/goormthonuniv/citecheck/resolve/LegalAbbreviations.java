package com.goormthonuniv.citecheck.resolve;

import java.util.Locale;
import java.util.Set;

/**
 * 마침표로 끝나지만 문장 끝이 아닌 약어들.
 */
final class LegalAbbreviations {

    private static final Set<String> KNOWN = Set.of(
            "v.", "vs.", "no.", "nos.", "cf.", "e.g.", "i.e.", "etc.", "id.", "ibid.", "supra.",
            "co.", "corp.", "inc.", "ltd.", "llc.", "bros.", "assocs.", "enters.", "indus.", "mfg.", "prods.",
            "bd.", "educ.", "dep't.", "dept.", "dist.", "cnty.", "sch.", "univ.", "hosp.", "ins.", "auth.",
            "comm'n.", "ass'n.", "nat'l.", "int'l.", "gov't.", "mun.", "prop.", "dev.", "fed.", "sav.",
            "servs.", "sys.", "tech.", "tel.", "transp.", "elec.", "med.", "ctr.", "ry.", "r.r.",
            "cal.", "wash.", "tex.", "fla.", "ala.", "ariz.", "colo.", "conn.", "mass.", "mich.", "minn.",
            "okla.", "tenn.", "wis.", "wyo.", "mont.", "nev.", "neb.", "kan.", "ore.", "ill.", "ind.",
            "cir.", "app.", "super.", "ct.", "sup.", "jr.", "sr.", "mr.", "mrs.", "ms.", "dr.", "st.", "mt.", "ave.",
            "rel.", "ex.", "al."
    );

    private LegalAbbreviations() {}

    /** 문장을 끝내는 마침표인지 (word는 마침표를 포함한 토큰) */
    static boolean endsSentence(String word) {
        String w = word;
        while (!w.isEmpty() && !Character.isLetterOrDigit(w.charAt(0))) {
            w = w.substring(1);
        }
        if (w.length() < 2) return false;
        if (KNOWN.contains(w.toLowerCase(Locale.ROOT))) return false;
        // 한 글자 이니셜 ("J.") 또는 점이 여러 개인 약어 ("U.S.", "N.Y.")
        if (w.length() == 2) return false;
        if (w.indexOf('.') < w.length() - 1) return false;
        // 짧은 대문자 약어 ("Bd.", "Co.", "Sch.")
        return !(Character.isUpperCase(w.charAt(0)) && w.length() <= 4);
    }

    static boolean isAbbreviation(String word) {
        return word.endsWith(".") && !endsSentence(word);
    }
}
