import com.slidebind.template.SlideBinder;
import com.slidebind.template.deck.DeckParagraph;
import com.slidebind.template.deck.DeckRun;
import com.slidebind.template.deck.poi.PoiDeck;
import com.slidebind.template.text.ParagraphText;
import com.slidebind.template.text.RunTextMapper;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SlideBindRunTextMapperTest {

    // ---------------- in-memory paragraph ----------------

    private static final class MemRun implements DeckRun {
        String text;
        final boolean writable;

        MemRun(String text, boolean writable) {
            this.text = text;
            this.writable = writable;
        }

        @Override public String getText() { return text; }

        @Override
        public void setText(String t) {
            if (!writable) throw new UnsupportedOperationException("fixed");
            text = t;
        }

        @Override public boolean isWritable() { return writable; }
    }

    private static final class MemParagraph implements DeckParagraph {
        final List<DeckRun> runs = new ArrayList<>();

        MemParagraph(String... texts) {
            for (String t : texts) runs.add(new MemRun(t, true));
        }

        MemParagraph lineBreak() {
            runs.add(new MemRun("\n", false));
            return this;
        }

        MemParagraph run(String t) {
            runs.add(new MemRun(t, true));
            return this;
        }

        @Override public List<DeckRun> getRuns() { return runs; }

        @Override
        public DeckRun appendRun(String text) {
            MemRun r = new MemRun(text, true);
            runs.add(r);
            return r;
        }
    }

    private static String text(DeckParagraph p) {
        return ParagraphText.of(p).getText();
    }

    private static DeckParagraph poiParagraph(XMLSlideShow ppt) {
        return new PoiDeck(ppt).slide(0).getShapes().get(0).getParagraphs().get(0);
    }

    // ---------------- scenarios ----------------

    @Test
    public void singleRun_replacedInPlace() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFTextBox box = SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Greeting", "Hello ${Name}!");

        new SlideBinder().process(ppt, Map.of("Name", "World"));

        XSLFTextParagraph p = SlideBindTestDecks.paragraph(box);
        assertEquals(1, p.getTextRuns().size());
        assertEquals("Hello World!", SlideBindTestDecks.paragraphText(p));
    }

    @Test
    public void tokenSplitAcrossRuns_isRedistributedExactly_andKeepsFormatting() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFTextBox box = SlideBindTestDecks.textBox(ppt.getSlides().get(0), "Greeting", "Hello ${Na", "me}!");

        new SlideBinder().process(ppt, Map.of("Name", "World"));

        XSLFTextParagraph p = SlideBindTestDecks.paragraph(box);
        assertEquals("Hello World!", SlideBindTestDecks.paragraphText(p));
        assertEquals(2, p.getTextRuns().size());
        assertFalse(p.getTextRuns().get(0).isBold());
        assertTrue(p.getTextRuns().get(1).isBold());
        // 12 characters over weights 10 and 4
        assertEquals("Hello Wo", SlideBindTestDecks.runText(p, 0));
        assertEquals("rld!", SlideBindTestDecks.runText(p, 1));
    }

    @Test
    public void untouchedRuns_keepTheirText() {
        MemParagraph p = new MemParagraph("Intro: ", "${A}", " and ", "tail");
        assertTrue(RunTextMapper.replaceSpan(p, 7, 11, "alpha"));
        assertEquals("Intro: alpha and tail", text(p));
        assertEquals("Intro: ", p.runs.get(0).getText());
        assertEquals("alpha", p.runs.get(1).getText());
        assertEquals(" and ", p.runs.get(2).getText());
    }

    @Test
    public void replacementEqualToOriginal_isNoOp() {
        MemParagraph p = new MemParagraph("abc", "def");
        assertFalse(RunTextMapper.replaceSpan(p, 1, 4, "bcd"));
        assertEquals("abc", p.runs.get(0).getText());
        assertEquals("def", p.runs.get(1).getText());
        assertFalse(RunTextMapper.rewrite(p, "abcdef"));
    }

    @Test
    public void invalidSpan_changesNothing() {
        MemParagraph p = new MemParagraph("abc");
        assertFalse(RunTextMapper.replaceSpan(p, 2, 9, "x"));
        assertFalse(RunTextMapper.replaceSpan(p, 2, 1, "x"));
        assertEquals("abc", text(p));
    }

    @Test
    public void emptyReplacement_acrossRuns() {
        MemParagraph p = new MemParagraph("x${Lo", "ng.Na", "me}y");
        assertTrue(RunTextMapper.replaceSpan(p, 1, 13, ""));
        assertEquals("xy", text(p));
    }

    @Test
    public void randomizedSplits_alwaysYieldExactText() {
        Random rnd = new Random(20240607L);
        String alphabet = "abcdefghij ${}.";
        for (int round = 0; round < 500; round++) {
            int runCount = 1 + rnd.nextInt(5);
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < runCount; i++) {
                StringBuilder sb = new StringBuilder();
                int len = rnd.nextInt(8);
                for (int k = 0; k < len; k++) sb.append(alphabet.charAt(rnd.nextInt(alphabet.length())));
                parts.add(sb.toString());
            }
            MemParagraph p = new MemParagraph(parts.toArray(new String[0]));
            String before = text(p);

            int start = before.isEmpty() ? 0 : rnd.nextInt(before.length() + 1);
            int end = start + ((before.length() == start) ? 0 : rnd.nextInt(before.length() - start + 1));
            StringBuilder repl = new StringBuilder();
            int rlen = rnd.nextInt(20);
            for (int k = 0; k < rlen; k++) repl.append((char) ('A' + rnd.nextInt(26)));

            String expected = before.substring(0, start) + repl + before.substring(end);
            RunTextMapper.replaceSpan(p, start, end, repl.toString());
            assertEquals(expected, text(p), "round " + round + " parts " + parts);
            assertEquals(runCount, p.runs.size(), "no run is added when every run is writable");
        }
    }

    @Test
    public void spanAcrossLineBreak_fallsBackToRebuild() {
        MemParagraph p = new MemParagraph("A ${Na").lineBreak().run("me} B");
        String before = text(p);
        assertEquals("A ${Na\nme} B", before);

        RunTextMapper.replaceSpan(p, 2, 10, "X");

        assertEquals("A X B\n", text(p), "line break runs stay in place");
        assertEquals("\n", p.runs.get(1).getText());
    }

    @Test
    public void spanBesideLineBreak_keepsBreak() {
        MemParagraph p = new MemParagraph("${A}").lineBreak().run("${B}");
        assertTrue(RunTextMapper.replaceSpan(p, 5, 9, "second"));
        assertTrue(RunTextMapper.replaceSpan(p, 0, 4, "first"));
        assertEquals("first\nsecond", text(p));
        assertEquals(3, p.runs.size());
    }

    @Test
    public void insertionAtEndOfParagraph_goesToLastRun() {
        MemParagraph p = new MemParagraph("ab", "cd");
        assertTrue(RunTextMapper.replaceSpan(p, 4, 4, "ef"));
        assertEquals("cdef", p.runs.get(1).getText());
    }

    @Test
    public void paragraphWithOnlyLineBreak_appendsRun() {
        MemParagraph p = new MemParagraph().lineBreak();
        assertTrue(RunTextMapper.replaceSpan(p, 1, 1, "after"));
        assertEquals("\nafter", text(p));
        assertEquals(2, p.runs.size());
    }

    @Test
    public void rewrite_touchesOnlyTheChangedStretch() {
        MemParagraph p = new MemParagraph("Item ", "Items[0]", ".Title");
        assertTrue(RunTextMapper.rewrite(p, "Item Items[12].Title"));
        assertEquals("Item ", p.runs.get(0).getText());
        assertEquals(".Title", p.runs.get(2).getText());
        assertEquals("Item Items[12].Title", text(p));
    }

    @Test
    public void poiLineBreakRuns_areFixed() {
        XMLSlideShow ppt = SlideBindTestDecks.deckWithSlide();
        XSLFSlide slide = ppt.getSlides().get(0);
        XSLFTextBox box = SlideBindTestDecks.textBox(slide, "Lines", "${A}");
        XSLFTextParagraph para = SlideBindTestDecks.paragraph(box);
        para.addLineBreak();
        para.addNewTextRun().setText("${B}");

        DeckParagraph p = poiParagraph(ppt);
        assertFalse(p.getRuns().get(1).isWritable());

        new SlideBinder().process(ppt, Map.of("A", "one", "B", "two"));
        assertEquals("one\ntwo", SlideBindTestDecks.paragraphText(para));
    }
}
