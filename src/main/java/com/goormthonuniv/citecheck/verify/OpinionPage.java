package com.goormthonuniv.citecheck.verify;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 가져온 판결 페이지의 검증용 요약.
 *
 * @param headerText 제목 + 헤딩 + 본문 앞부분. 인용이 "이 페이지 자신의 인용"으로 나오는 영역
 */
public record OpinionPage(
        String url,
        String title,
        List<String> headings,
        String headerText,
        String bodyText
) {
    static final int HEADER_BODY_CHARS = 1500;
    private static final int MAX_BODY_CHARS = 200_000;

    public static OpinionPage parse(String url, String html) {
        Document doc = Jsoup.parse(html == null ? "" : html, url);
        doc.select("script,noscript,style,nav,footer,aside").remove();

        String title = doc.title().strip();
        List<String> headings = new ArrayList<>();
        for (Element h : doc.select("h1, h2")) {
            String t = h.text().strip();
            if (!t.isEmpty()) headings.add(t);
            if (headings.size() >= 4) break;
        }

        String body = doc.body() == null ? "" : doc.body().text()
                .replace(' ', ' ')
                .replaceAll("\\s{2,}", " ")
                .strip();
        if (body.length() > MAX_BODY_CHARS) body = body.substring(0, MAX_BODY_CHARS);

        StringBuilder header = new StringBuilder(title);
        for (String h : headings) header.append('\n').append(h);
        header.append('\n').append(body, 0, Math.min(body.length(), HEADER_BODY_CHARS));

        return new OpinionPage(url, title, List.copyOf(headings), header.toString(), body);
    }
}
