package com.goormthonuniv.citecheck.extract;

import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 리포터 약어 사전.
 * - 원문 표기(variant)를 공백 무시 키로 정규 리포터에 매핑한다 ("Wn.2d" / "Wash. 2d" / "Wash.2d" → "Wash. 2d")
 * - 병렬 인용 계열(같은 관할의 공식/지역/비공식 리포터, 연방대법원 3종)을 판정한다
 */
@Component
public class ReporterCatalog {

    private static final Set<String> SCOTUS = Set.of("US");
    private static final Set<String> FED = Set.of("FED");

    private static final Set<String> PACIFIC = Set.of(
            "WA", "OR", "CA", "AZ", "CO", "ID", "MT", "NV", "NM", "UT", "WY", "KS", "OK", "AK", "HI");
    private static final Set<String> ATLANTIC = Set.of(
            "CT", "DE", "DC", "ME", "MD", "NH", "NJ", "PA", "RI", "VT");
    private static final Set<String> NORTH_EASTERN = Set.of("IL", "IN", "MA", "NY", "OH");
    private static final Set<String> NORTH_WESTERN = Set.of("IA", "MI", "MN", "NE", "ND", "SD", "WI");
    private static final Set<String> SOUTH_EASTERN = Set.of("GA", "NC", "SC", "VA", "WV");
    private static final Set<String> SOUTH_WESTERN = Set.of("AR", "KY", "MO", "TN", "TX");
    private static final Set<String> SOUTHERN = Set.of("AL", "FL", "LA", "MS");

    private final Map<String, Reporter> byKey = new HashMap<>();
    private final List<Reporter> reporters = new ArrayList<>();

    public ReporterCatalog() {
        // ===== 연방대법원 =====
        add("U.S.", "U.S.", ReporterClass.SUPREME_COURT, SCOTUS, "U. S.");
        add("S. Ct.", "S. Ct.", ReporterClass.SUPREME_COURT, SCOTUS, "S.Ct.", "S Ct.");
        add("L. Ed.", "L. Ed.", ReporterClass.SUPREME_COURT, SCOTUS, "L.Ed.");
        add("L. Ed. 2d", "L. Ed.", ReporterClass.SUPREME_COURT, SCOTUS, "L.Ed.2d", "L. Ed.2d", "L.Ed. 2d");

        // ===== 연방 하급심 =====
        add("F.", "F.", ReporterClass.FEDERAL, FED);
        add("F.2d", "F.", ReporterClass.FEDERAL, FED, "F. 2d");
        add("F.3d", "F.", ReporterClass.FEDERAL, FED, "F. 3d");
        add("F.4th", "F.", ReporterClass.FEDERAL, FED, "F. 4th");
        add("F. Supp.", "F. Supp.", ReporterClass.FEDERAL, FED, "F.Supp.");
        add("F. Supp. 2d", "F. Supp.", ReporterClass.FEDERAL, FED, "F.Supp.2d", "F. Supp.2d");
        add("F. Supp. 3d", "F. Supp.", ReporterClass.FEDERAL, FED, "F.Supp.3d", "F. Supp.3d");
        add("F. App'x", "F. App'x", ReporterClass.FEDERAL, FED, "F.App'x", "Fed. Appx.", "Fed. App'x", "F. Appx.");
        add("F.R.D.", "F.R.D.", ReporterClass.FEDERAL, FED);
        add("B.R.", "B.R.", ReporterClass.FEDERAL, FED);
        add("Fed. Cl.", "Fed. Cl.", ReporterClass.FEDERAL, FED);

        // ===== 지역 리포터 =====
        regional("P.", PACIFIC, "P.", "P.2d", "P.3d");
        regional("A.", ATLANTIC, "A.", "A.2d", "A.3d");
        regional("N.E.", NORTH_EASTERN, "N.E.", "N.E.2d", "N.E.3d");
        regional("N.W.", NORTH_WESTERN, "N.W.", "N.W.2d");
        regional("S.E.", SOUTH_EASTERN, "S.E.", "S.E.2d");
        regional("S.W.", SOUTH_WESTERN, "S.W.", "S.W.2d", "S.W.3d");
        regional("So.", SOUTHERN, "So.", "So. 2d", "So. 3d");

        // ===== 주 공식 리포터 =====
        add("Wash.", "Wash.", ReporterClass.STATE_OFFICIAL, Set.of("WA"), "Wn.");
        add("Wash. 2d", "Wash.", ReporterClass.STATE_OFFICIAL, Set.of("WA"), "Wn.2d", "Wn. 2d", "Wash.2d");
        add("Wash. App.", "Wash. App.", ReporterClass.STATE_OFFICIAL, Set.of("WA"), "Wn. App.", "Wn.App.");
        add("Wash. App. 2d", "Wash. App.", ReporterClass.STATE_OFFICIAL, Set.of("WA"), "Wn. App. 2d", "Wn.App.2d");

        official("CA", "Cal.", "Cal.", "Cal. 2d", "Cal. 3d", "Cal. 4th", "Cal. 5th");
        official("CA", "Cal. App.", "Cal. App.", "Cal. App. 2d", "Cal. App. 3d", "Cal. App. 4th", "Cal. App. 5th");
        unofficial("CA", "Cal. Rptr.", "Cal. Rptr.", "Cal. Rptr. 2d", "Cal. Rptr. 3d");

        official("NY", "N.Y.", "N.Y.", "N.Y.2d", "N.Y.3d");
        official("NY", "A.D.", "A.D.", "A.D.2d", "A.D.3d");
        unofficial("NY", "N.Y.S.", "N.Y.S.", "N.Y.S.2d", "N.Y.S.3d");

        official("IL", "Ill.", "Ill.", "Ill. 2d");
        official("IL", "Ill. App.", "Ill. App.", "Ill. App. 2d", "Ill. App. 3d");
        unofficial("IL", "Ill. Dec.", "Ill. Dec.");

        official("OR", "Or.", "Or.");
        official("OR", "Or. App.", "Or. App.");
        official("AZ", "Ariz.", "Ariz.");
        official("AZ", "Ariz. App.", "Ariz. App.");
        official("CO", "Colo.", "Colo.");
        official("ID", "Idaho", "Idaho");
        official("MT", "Mont.", "Mont.");
        official("NV", "Nev.", "Nev.");
        official("NM", "N.M.", "N.M.");
        official("UT", "Utah", "Utah", "Utah 2d");
        official("WY", "Wyo.", "Wyo.");
        official("KS", "Kan.", "Kan.");
        official("KS", "Kan. App.", "Kan. App.", "Kan. App. 2d");
        official("OK", "Okla.", "Okla.");
        official("HI", "Haw.", "Haw.");
        official("MA", "Mass.", "Mass.");
        official("MA", "Mass. App. Ct.", "Mass. App. Ct.");
        official("OH", "Ohio St.", "Ohio St.", "Ohio St. 2d", "Ohio St. 3d");
        official("IN", "Ind.", "Ind.");
        official("MI", "Mich.", "Mich.");
        official("MI", "Mich. App.", "Mich. App.");
        official("MN", "Minn.", "Minn.");
        official("WI", "Wis.", "Wis.", "Wis. 2d");
        official("IA", "Iowa", "Iowa");
        official("NE", "Neb.", "Neb.");
        official("ND", "N.D.", "N.D.");
        official("SD", "S.D.", "S.D.");
        official("PA", "Pa.", "Pa.");
        official("PA", "Pa. Super.", "Pa. Super.");
        official("NJ", "N.J.", "N.J.");
        official("NJ", "N.J. Super.", "N.J. Super.");
        official("CT", "Conn.", "Conn.");
        official("CT", "Conn. App.", "Conn. App.");
        official("MD", "Md.", "Md.");
        official("MD", "Md. App.", "Md. App.");
        official("VA", "Va.", "Va.");
        official("VA", "Va. App.", "Va. App.");
        official("GA", "Ga.", "Ga.");
        official("GA", "Ga. App.", "Ga. App.");
        official("NC", "N.C.", "N.C.");
        official("NC", "N.C. App.", "N.C. App.");
        official("SC", "S.C.", "S.C.");
        official("KY", "Ky.", "Ky.");
        official("MO", "Mo.", "Mo.");
        official("TN", "Tenn.", "Tenn.");
        official("AR", "Ark.", "Ark.");
        official("LA", "La.", "La.");
        official("MS", "Miss.", "Miss.");
        official("ME", "Me.", "Me.");
        official("NH", "N.H.", "N.H.");
        official("RI", "R.I.", "R.I.");
        official("VT", "Vt.", "Vt.");
        official("DE", "Del.", "Del.");
        official("WV", "W. Va.", "W. Va.");

        // ===== 데이터베이스 인용 (권호 자리에 연도) =====
        add("WL", "WL", ReporterClass.DATABASE, Set.of());
        add("U.S. Dist. LEXIS", "LEXIS", ReporterClass.DATABASE, Set.of(), "U.S.Dist.LEXIS");
        add("U.S. App. LEXIS", "LEXIS", ReporterClass.DATABASE, Set.of(), "U.S.App.LEXIS");
        add("U.S. LEXIS", "LEXIS", ReporterClass.DATABASE, Set.of());
    }

    /** 원문 표기 → 정규 리포터 (공백/대소문자 무시) */
    public Optional<Reporter> lookup(String spelling) {
        if (spelling == null || spelling.isBlank()) return Optional.empty();
        return Optional.ofNullable(byKey.get(key(spelling)));
    }

    public List<Reporter> reporters() {
        return Collections.unmodifiableList(reporters);
    }

    /**
     * 두 리포터가 한 판결의 병렬 인용이 될 수 있는지.
     * 같은 계열(권만 다른 경우 포함)은 항상 false. 판단이 애매하면 false.
     */
    public boolean areParallel(Reporter a, Reporter b) {
        if (a == null || b == null) return false;
        if (a.family().equals(b.family())) return false;

        ReporterClass ca = a.reporterClass();
        ReporterClass cb = b.reporterClass();
        if (ca == ReporterClass.DATABASE || cb == ReporterClass.DATABASE) return false;
        if (ca == ReporterClass.FEDERAL || cb == ReporterClass.FEDERAL) return false;

        if (ca == ReporterClass.SUPREME_COURT || cb == ReporterClass.SUPREME_COURT) {
            return ca == cb;
        }
        // 주 사건: 공식/지역/비공식 중 서로 다른 종류이면서 관할이 겹쳐야 한다
        if (ca == cb) return false;
        return !Collections.disjoint(a.jurisdictions(), b.jurisdictions());
    }

    /** 공백 제거 + 소문자 + 아포스트로피 통일 */
    public static String key(String spelling) {
        StringBuilder sb = new StringBuilder(spelling.length());
        for (int i = 0; i < spelling.length(); i++) {
            char ch = spelling.charAt(i);
            if (Character.isWhitespace(ch)) continue;
            if (ch == '’' || ch == '‘') ch = '\'';
            sb.append(Character.toLowerCase(ch));
        }
        return sb.toString();
    }

    // ------------------------ 내부 유틸 ------------------------

    private void regional(String family, Set<String> states, String... series) {
        for (String s : series) {
            add(s, family, ReporterClass.REGIONAL, states, spaced(s));
        }
    }

    private void official(String state, String family, String... series) {
        for (String s : series) {
            add(s, family, ReporterClass.STATE_OFFICIAL, Set.of(state), compact(s));
        }
    }

    private void unofficial(String state, String family, String... series) {
        for (String s : series) {
            add(s, family, ReporterClass.STATE_UNOFFICIAL, Set.of(state), compact(s));
        }
    }

    private void add(String canonical, String family, ReporterClass cls, Set<String> jurisdictions, String... variants) {
        LinkedHashSet<String> all = new LinkedHashSet<>();
        all.add(canonical);
        for (String v : variants) {
            if (v != null) all.add(v);
        }
        Reporter r = new Reporter(canonical, family, cls, jurisdictions, List.copyOf(all));
        reporters.add(r);
        for (String v : all) {
            byKey.putIfAbsent(key(v), r);
        }
    }

    /** "P.3d" → "P. 3d" */
    private static String spaced(String series) {
        return series.replaceAll("\\.(\\d)", ". $1");
    }

    /** "Cal. 4th" → "Cal.4th" */
    private static String compact(String series) {
        return series.replaceAll("\\.\\s+(\\d)", ".$1");
    }
}
