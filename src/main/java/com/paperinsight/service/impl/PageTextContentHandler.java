package com.paperinsight.service.impl;

import org.xml.sax.Attributes;
import org.xml.sax.helpers.DefaultHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * 按页收集 Tika XHTML 输出的 SAX 处理器
 *
 * <p>PDF 解析器为每页输出 {@code <div class="page">}; 其他格式没有分页标记, 整体视为一页。
 * 段落与页结束时补换行, 保证文本按行切分。</p>
 *
 * @author PaperInsight
 * @since 2026-09-18
 */
class PageTextContentHandler extends DefaultHandler {

    private static final String PAGE_CLASS = "page";

    private final List<StringBuilder> pages = new ArrayList<>();

    private StringBuilder current = new StringBuilder();

    private boolean paged;

    @Override
    public void startElement(String uri, String localName, String qName, Attributes attributes) {
        if ("div".equals(localName) && PAGE_CLASS.equals(attributes.getValue("class"))) {
            if (paged || current.length() > 0) {
                pages.add(current);
            }
            current = new StringBuilder();
            paged = true;
        }
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
        if ("p".equals(localName) || "div".equals(localName) || "h1".equals(localName)
                || "h2".equals(localName) || "h3".equals(localName) || "li".equals(localName)) {
            current.append('\n');
        }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        current.append(ch, start, length);
    }

    @Override
    public void ignorableWhitespace(char[] ch, int start, int length) {
        current.append(ch, start, length);
    }

    /**
     * 已收集的各页文本
     */
    List<String> getPages() {
        List<String> result = new ArrayList<>();
        for (StringBuilder page : pages) {
            result.add(page.toString());
        }
        result.add(current.toString());
        return result;
    }
}
