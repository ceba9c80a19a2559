package com.dubbi.hostmaster.portal.web;

import com.dubbi.hostmaster.common.util.PortalUrls;
import com.dubbi.hostmaster.portal.error.StructuralException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.FormElement;
import org.jsoup.select.Elements;

/**
 * 폼 페이지에서 제출에 필요한 hidden 필드(토큰, destdisp, aplyid 등)와 action URL을 추출한다.
 * 조건에 맞는 폼이 없으면 오류 페이지, 세션 만료, 입력 검증 실패 중 하나로 본다.
 */
public class FormTokenExtractor {

    public static Predicate<String> actionContains(String fragment) {
        return action -> action.contains(fragment);
    }

    public static Predicate<String> anyAction() {
        return action -> true;
    }

    public FormTokens extract(Document page, Predicate<String> actionPredicate) {
        for (Element form : page.select("form")) {
            String action = form.attr("action");
            if (!actionPredicate.test(action)) continue;
            return tokensOf(page, form, action);
        }
        throw new StructuralException("no matching form on " + page.location() + " (" + page.select("form").size()
                + " forms, title '" + page.title() + "')");
    }

    private static FormTokens tokensOf(Document page, Element form, String action) {
        // table layouts make the parser hoist inputs out of the <form>; FormElement keeps the association
        Elements controls = form instanceof FormElement fe ? fe.elements() : form.select("input, select, textarea");
        if (controls.isEmpty()) controls = form.select("input, select, textarea");

        Map<String, String> hidden = new LinkedHashMap<>();
        Map<String, String> named = new LinkedHashMap<>();
        String firstInputValue = null;
        for (Element control : controls) {
            if (!control.normalName().equals("input")) continue;
            if (firstInputValue == null && control.hasAttr("value")) {
                firstInputValue = control.attr("value");
            }
            String name = control.attr("name");
            if (name.isEmpty()) continue;
            named.putIfAbsent(name, control.attr("value"));
            if ("hidden".equalsIgnoreCase(control.attr("type"))) {
                hidden.put(name, control.attr("value"));
            }
        }

        String actionUrl = form.absUrl("action");
        if (actionUrl.isEmpty()) {
            actionUrl = PortalUrls.resolve(page.location(), action.isEmpty() ? page.location() : action);
        }
        return new FormTokens(actionUrl, hidden, named, firstInputValue);
    }
}
