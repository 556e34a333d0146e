package com.lemur.backend.service;

import com.lemur.backend.client.PatchCollaborator;
import com.lemur.backend.shield.ContentShield;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies patch instructions to the shielded document and rebuilds the full document.
 * <p>
 * Script elements the patcher adds arrive as literal markup, not placeholders; any that
 * did not survive restoration are put back before the closing body tag. If the patcher
 * dropped them entirely, scripts are taken straight from the instructions. Presence is a
 * plain substring check, so a script that was reformatted can end up twice.
 */
@Service
public class EditApplicationService {

    private static final Logger log = LoggerFactory.getLogger(EditApplicationService.class);

    private static final Pattern SCRIPT = Pattern.compile("<script[^>]*>[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
    private static final String BODY_CLOSE = "</body>";

    private final PatchCollaborator patchCollaborator;
    private final ContentShield contentShield;

    public EditApplicationService(PatchCollaborator patchCollaborator, ContentShield contentShield) {
        this.patchCollaborator = patchCollaborator;
        this.contentShield = contentShield;
    }

    public EditResult apply(String shieldedBaseline, String editInstructions, Map<String, String> placeholders)
            throws InterruptedException {
        String patched = patchCollaborator.apply(shieldedBaseline, editInstructions);
        String document = contentShield.restore(patched, placeholders);

        List<String> scripts = findScripts(patched);
        if (scripts.isEmpty() && editInstructions.toLowerCase(Locale.ROOT).contains("<script")) {
            scripts = findScripts(editInstructions);
            log.info("[PATCH] No scripts in patched output, salvaging {} from edit instructions", scripts.size());
        }

        for (String script : scripts) {
            if (!document.contains(script)) {
                document = insertBeforeBodyClose(document, script);
                log.info("[PATCH] Preserved script element dropped during restore ({} chars)", script.length());
            }
        }
        return new EditResult(document, patched);
    }

    static List<String> findScripts(String text) {
        List<String> scripts = new ArrayList<>();
        Matcher matcher = SCRIPT.matcher(text);
        while (matcher.find()) {
            scripts.add(matcher.group());
        }
        return scripts;
    }

    /**
     * Insert before the last closing body tag, or append when there is none.
     */
    static String insertBeforeBodyClose(String document, String fragment) {
        for (int i = document.length() - BODY_CLOSE.length(); i >= 0; i--) {
            if (document.regionMatches(true, i, BODY_CLOSE, 0, BODY_CLOSE.length())) {
                return document.substring(0, i) + fragment + "\n" + document.substring(i);
            }
        }
        return document + fragment + "\n";
    }
}
