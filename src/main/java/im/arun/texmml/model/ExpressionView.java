package im.arun.texmml.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serializable snapshot of one {@link Expression} and its subtree, without the
 * parent links.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ExpressionView {

    @JsonProperty("type")
    private String type;

    @JsonProperty("name")
    private String name;

    @JsonProperty("math_mode")
    private boolean mathMode;

    @JsonProperty("line")
    private int line;

    @JsonProperty("tag")
    private Object tag;

    @JsonProperty("options")
    private Map<String, String> options;

    @JsonProperty("option_expressions")
    private List<ExpressionView> optionExpressions;

    @JsonProperty("groups")
    private List<List<ExpressionView>> groups;

    public static ExpressionView of(Expression expression) {
        ExpressionView view = new ExpressionView();
        view.setType(expression.getType().name().toLowerCase(Locale.ROOT));
        view.setName(expression.getName());
        view.setMathMode(expression.isMathMode());
        view.setLine(expression.getLine());
        view.setTag(expression.getTag());
        expression.getOptions().ifPresent(options -> {
            if (options.isKeyValue()) {
                view.setOptions(options.getKeyValues());
            } else {
                view.setOptionExpressions(of(options.getExpressions()));
            }
        });
        List<List<ExpressionView>> groups = new ArrayList<>(expression.groupCount());
        for (List<Expression> group : expression.getGroups()) {
            groups.add(of(group));
        }
        view.setGroups(groups);
        return view;
    }

    private static List<ExpressionView> of(List<Expression> expressions) {
        List<ExpressionView> views = new ArrayList<>(expressions.size());
        for (Expression child : expressions) {
            views.add(of(child));
        }
        return views;
    }
}
