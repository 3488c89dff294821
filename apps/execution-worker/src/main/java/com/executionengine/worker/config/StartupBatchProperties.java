package com.executionengine.worker.config;

import com.executionengine.domain.orders.ExecutionStyle;
import com.executionengine.domain.orders.OrderSide;
import com.executionengine.domain.orders.OrderType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Orders executed once at startup, for exercising the engine against paper venues. */
@ConfigurationProperties(prefix = "execution.startup-batch")
public class StartupBatchProperties {
  private boolean enabled = false;
  private List<Order> orders = new ArrayList<>();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<Order> getOrders() {
    return orders;
  }

  public void setOrders(List<Order> orders) {
    this.orders = orders;
  }

  public static class Order {
    private String venue;
    private String symbol;
    private OrderSide side = OrderSide.BUY;
    private OrderType type = OrderType.LIMIT;
    private ExecutionStyle style = ExecutionStyle.MAKER;
    private BigDecimal amount;
    private BigDecimal price;

    public String getVenue() {
      return venue;
    }

    public void setVenue(String venue) {
      this.venue = venue;
    }

    public String getSymbol() {
      return symbol;
    }

    public void setSymbol(String symbol) {
      this.symbol = symbol;
    }

    public OrderSide getSide() {
      return side;
    }

    public void setSide(OrderSide side) {
      this.side = side;
    }

    public OrderType getType() {
      return type;
    }

    public void setType(OrderType type) {
      this.type = type;
    }

    public ExecutionStyle getStyle() {
      return style;
    }

    public void setStyle(ExecutionStyle style) {
      this.style = style;
    }

    public BigDecimal getAmount() {
      return amount;
    }

    public void setAmount(BigDecimal amount) {
      this.amount = amount;
    }

    public BigDecimal getPrice() {
      return price;
    }

    public void setPrice(BigDecimal price) {
      this.price = price;
    }
  }
}
