package ru.tigran.feedbacksync.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceHttp тесты")
class SourceHttpTest {

    @Test
    @DisplayName("rel=next извлекается из Link заголовка в любом порядке")
    void extractsNextLink() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.LINK, "<https://api.github.com/x?page=1>; rel=\"prev\", "
                + "<https://api.github.com/x?page=3>; rel=\"next\"");

        assertEquals("https://api.github.com/x?page=3", SourceHttp.nextLink(headers));
    }

    @Test
    @DisplayName("Без Link заголовка или без rel=next следующей страницы нет")
    void noNextLink() {
        HttpHeaders lastPage = new HttpHeaders();
        lastPage.add(HttpHeaders.LINK, "<https://api.github.com/x?page=1>; rel=\"first\"");

        assertNull(SourceHttp.nextLink(new HttpHeaders()));
        assertNull(SourceHttp.nextLink(lastPage));
    }

    @Test
    @DisplayName("HTML поста превращается в текст с сохранением переносов")
    void htmlToText() {
        assertEquals("Line one\nLine <two>", SourceHttp.htmlToText("<p>Line <b>one</b></p><p>Line &lt;two&gt;</p>"));
        assertEquals("", SourceHttp.htmlToText(null));
    }
}
