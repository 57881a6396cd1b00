package io.vena.folio;

import io.vena.folio.annotations.Collection;
import io.vena.folio.annotations.Field;
import io.vena.folio.annotations.Hook;
import io.vena.folio.annotations.Index;
import io.vena.folio.annotations.Ref;
import io.vena.folio.annotations.Required;
import io.vena.folio.annotations.SingleCollection;
import io.vena.folio.annotations.Unique;
import io.vena.folio.annotations.Validate;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;

/**
 * Model classes shared by tests of {@link DocumentStore} implementations,
 * and a {@link Folio} built on the store under test.
 */
public abstract class AbstractFolioTest {
	protected DocumentStore store;
	protected Folio folio;

	/**
	 * Called once per test. Each call should return a store with no documents in it.
	 */
	protected abstract DocumentStore createStore();

	@BeforeEach
	public void setUpFolio() {
		store = createStore();
		folio = new Folio(store, folioSettings());
	}

	protected FolioSettings folioSettings() {
		return FolioSettings.defaults();
	}

	public static class Customer {
		public ObjectId id;
		@Required public String name;
		@Unique @Validate("email") public String email;
		@Index public int tier;
		public Address address;
		public List<String> tags = new ArrayList<>();
		public Date since;
		public transient int saves;

		public Customer() { }

		public Customer(String name, String email, int tier) {
			this.name = name;
			this.email = email;
			this.tier = tier;
		}

		@Hook("saved")
		public void countSaves() {
			saves++;
		}
	}

	public static class Address {
		public String street;
		public String city;

		public Address() { }

		public Address(String street, String city) {
			this.street = street;
			this.city = city;
		}
	}

	@Collection("purchase_orders")
	public static class Order {
		public ObjectId id;
		@Ref(with = "name") public Reference<Customer> customer;
		@Field("amt") public long amountCents;
		public List<LineItem> items = new ArrayList<>();
	}

	public static class LineItem {
		public String sku;
		public int quantity;

		public LineItem() { }

		public LineItem(String sku, int quantity) {
			this.sku = sku;
			this.quantity = quantity;
		}
	}

	@SingleCollection
	public static class Shape {
		public ObjectId id;
		public String label;
	}

	public static class Circle extends Shape {
		public double radius;
	}

	public static class Square extends Shape {
		public double side;
	}
}
