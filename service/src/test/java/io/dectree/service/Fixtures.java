// file: service/src/test/java/io/dectree/service/Fixtures.java
package io.dectree.service;

import io.dectree.core.Ingestor;
import io.dectree.core.MultilingualRecord;
import io.dectree.core.MultilingualRecord.LanguageText;
import io.dectree.core.NodeIndex;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/** Small bilingual corpus shared by the service tests. Ids follow list order (1..8). */
public final class Fixtures {
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {
    }

    public static List<MultilingualRecord> records() {
        return List.of(
                rec("1", "Die Welt ist alles, was der Fall ist.", "The world is everything that is the case."),
                rec("1.1", "Die Welt ist die Gesamtheit der Tatsachen, nicht der Dinge.", "The world is the totality of facts, not of things."),
                rec("1.11", "Die Welt ist durch die Tatsachen bestimmt.", "The world is determined by the facts."),
                rec("1.12", "Denn, die Gesamtheit der Tatsachen bestimmt, was der Fall ist.", null),
                rec("1.2", "Die Welt zerfällt in Tatsachen.", "The world divides into facts."),
                rec("2", "Was der Fall ist, die Tatsache, ist das Bestehen von Sachverhalten.", "What is the case, a fact, is the existence of states of affairs."),
                rec("2.01", "Der Sachverhalt ist eine Verbindung von Gegenständen.", "An atomic fact is a combination of objects."),
                rec("2.0121", "Es erschiene gleichsam als Zufall.", "It would, so to speak, appear as an accident."));
    }

    public static NodeIndex index() {
        return new Ingestor("de", CLOCK).ingestMultilingual(records());
    }

    private static MultilingualRecord rec(String name, String de, String en) {
        return en == null
                ? new MultilingualRecord(name, List.of(new LanguageText("de", de, "German original")))
                : new MultilingualRecord(name, List.of(
                        new LanguageText("de", de, "German original"),
                        new LanguageText("en-ogden", en, "Ogden")));
    }
}
