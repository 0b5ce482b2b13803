package shop.eda.order.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import shop.eda.order.model.OrderRequest;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Constraint tests for OrderRequest.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @Test
    void testOrderRequest_Valid() {
        Set<ConstraintViolation<OrderRequest>> violations =
                validator.validate(new OrderRequest(1, "James", "22 Bugs Bunny Street", 3));
        assertTrue(violations.isEmpty(), "Valid OrderRequest should have no violations");
    }

    @Test
    void testOrderRequest_ZeroQuantity() {
        assertViolationOn(new OrderRequest(1, "James", "22 Bugs Bunny Street", 0), "quantity");
    }

    @Test
    void testOrderRequest_NegativeQuantity() {
        assertViolationOn(new OrderRequest(1, "James", "22 Bugs Bunny Street", -1), "quantity");
    }

    @Test
    void testOrderRequest_NullQuantity() {
        assertViolationOn(new OrderRequest(1, "James", "22 Bugs Bunny Street", null), "quantity");
    }

    @Test
    void testOrderRequest_NullItemId() {
        assertViolationOn(new OrderRequest(null, "James", "22 Bugs Bunny Street", 1), "itemId");
    }

    @Test
    void testOrderRequest_BlankName() {
        assertViolationOn(new OrderRequest(1, "   ", "22 Bugs Bunny Street", 1), "name");
    }

    @Test
    void testOrderRequest_EmptyAddress() {
        assertViolationOn(new OrderRequest(1, "James", "", 1), "address");
    }

    private static void assertViolationOn(OrderRequest request, String property) {
        Set<ConstraintViolation<OrderRequest>> violations = validator.validate(request);
        assertFalse(violations.isEmpty(), "Expected a violation on " + property);
        assertTrue(violations.stream().anyMatch(v -> v.getPropertyPath().toString().equals(property)));
    }
}
