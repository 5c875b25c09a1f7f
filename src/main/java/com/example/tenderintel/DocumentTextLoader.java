package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Читает уже декодированный текст документа.
 * Для HTML-страниц тендерных площадок разметка удаляется, строки абзацев и таблиц сохраняются.
 */
@Slf4j
public class DocumentTextLoader {

    public String load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a readable file: " + path);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".html") || name.endsWith(".htm")) {
            String text = htmlToText(content);
            log.info("Loaded HTML {} ({} chars of text)", path, text.length());
            return text;
        }
        log.info("Loaded text {} ({} chars)", path, content.length());
        return content;
    }

    /**
     * Каждый блочный элемент (абзац, строка таблицы, пункт списка, div) начинает новую строку,
     * иначе построчный разбор спецификаций не работает. Ячейки строки таблицы идут через пробел.
     * Текст вне блоков тоже сохраняется.
     */
    String htmlToText(String html) {
        Document doc = Jsoup.parse(html);
        StringBuilder raw = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    raw.append(((TextNode) node).text());
                } else if (node instanceof Element) {
                    Element element = (Element) node;
                    if (isCell(element)) {
                        raw.append(' ');
                    } else if ("br".equals(element.normalName()) || element.isBlock()) {
                        raw.append('\n');
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element) {
                    Element element = (Element) node;
                    if (element.isBlock() && !isCell(element)) {
                        raw.append('\n');
                    }
                }
            }
        }, doc.body());

        StringBuilder text = new StringBuilder();
        for (String line : raw.toString().split("\n")) {
            String clean = line.replaceAll("\\s+", " ").strip();
            if (!clean.isEmpty()) {
                text.append(clean).append('\n');
            }
        }
        return text.toString();
    }

    private static boolean isCell(Element element) {
        String name = element.normalName();
        return "td".equals(name) || "th".equals(name);
    }
}
