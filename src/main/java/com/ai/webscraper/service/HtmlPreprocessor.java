package com.ai.webscraper.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * AI 호출 전 HTML 정리 (토큰 절약).
 * 데이터가 없는 요소와 주석만 제거하고, JSON-LD 구조화 데이터 스크립트는 남긴다.
 */
@Slf4j
public class HtmlPreprocessor {

    private static final String REMOVABLE = "style, noscript, iframe, embed, object, applet, link, svg";
    private static final String JSON_LD = "application/ld+json";

    public String clean(String html) {
        if (html == null || html.isBlank()) {
            return html;
        }

        Document doc = Jsoup.parse(html);
        doc.select(REMOVABLE).remove();
        doc.select("script").stream()
                .filter(script -> !JSON_LD.equalsIgnoreCase(script.attr("type").trim()))
                .forEach(Node::remove);
        removeComments(doc);

        String cleaned = doc.outerHtml();
        log.debug("HTML 전처리 완료: {} → {} chars", html.length(), cleaned.length());
        return cleaned;
    }

    private void removeComments(Document doc) {
        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof Comment) {
                    comments.add(node);
                }
            }

            @Override
            public void tail(Node node, int depth) {
            }
        }, doc);
        comments.forEach(Node::remove);
    }
}
