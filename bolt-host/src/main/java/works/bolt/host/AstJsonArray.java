package works.bolt.host;

import java.util.ArrayList;
import java.util.List;

import static java.util.stream.Collectors.toCollection;
import static works.bolt.host.Attributes.required;

public record AstJsonArray(
	AstChildren<AstJson> elements
) implements AstJson {
	public AstJsonArray {
		required(AstJsonArray.class, "elements", elements);
	}

	@Override
	public List<Object> evaluate() {
		// Mutable, matching what Jackson itself produces for arrays
		return elements.stream()
			.map(AstJson::evaluate)
			.collect(toCollection(ArrayList::new));
	}
}
