package io.ehsdesk.runtime;

import io.ehsdesk.model.Actor;
import io.ehsdesk.model.RuleFeedback;
import io.ehsdesk.model.RuleView;

import java.util.List;

/** Operations shared by every signed-in role. */
public interface Desk {
    Actor actor();

    List<RuleView> listRules();

    List<RuleFeedback> listFeedback();
}
