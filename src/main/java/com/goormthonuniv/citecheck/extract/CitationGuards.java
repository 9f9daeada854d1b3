package com.goormthonuniv.citecheck.extract;

/**
 * 오탐 방지 규칙. 두 매처가 공유한다.
 */
final class CitationGuards {

    static final int MIN_YEAR = 1700;
    static final int MAX_YEAR = 2100;
    /** 인용 하나에 붙는 핀포인트 상한. 숫자 나열이 끝없이 이어져도 매칭 비용이 묶인다. */
    static final int MAX_PINS = 10;

    private static final int MAX_PAGE_DIGITS = 9;

    private CitationGuards() {}

    static boolean plausible(Reporter reporter, String volume, String page) {
        if (volume == null || page == null || volume.isEmpty() || page.isEmpty()) return false;
        if (volume.length() > 4 || page.length() > MAX_PAGE_DIGITS) return false;
        int vol = Integer.parseInt(volume);
        int pg = Integer.parseInt(page);
        if (vol <= 0 || pg <= 0) return false;

        boolean yearShaped = volume.length() == 4 && vol >= MIN_YEAR && vol <= MAX_YEAR;
        if (reporter.isDatabase()) {
            // "2020 WL 1234567": 권호 자리는 연도
            return yearShaped;
        }
        // "In 2016 U.S. 10-year ...", "By 2003 Iowa 150 farms": 연도 + 약어 + 숫자는 문장
        if (yearShaped) return false;
        return page.length() <= 5;
    }

    /** "10-year" 처럼 하이픈으로 단어에 붙은 숫자는 면수가 아니다 */
    static boolean pageRunsIntoWord(String text, int pageEnd) {
        if (pageEnd + 1 >= text.length()) return false;
        char dash = text.charAt(pageEnd);
        return (dash == '-' || dash == '–') && Character.isLetter(text.charAt(pageEnd + 1));
    }
}
